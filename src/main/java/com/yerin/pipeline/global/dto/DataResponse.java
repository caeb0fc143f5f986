package com.yerin.pipeline.global.dto;

public record DataResponse<T>(T data) {
    public static <T> DataResponse<T> from(T data) {
        return new DataResponse<>(data);
    }
}
