package com.yerin.pipeline.repository;

import com.yerin.pipeline.domain.ContentProcessingState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ContentProcessingStateRepository extends JpaRepository<ContentProcessingState, String> {

    @Query("""
       select s.pipelineVersion as pipelineVersion, count(s) as total
         from ContentProcessingState s
        group by s.pipelineVersion
       """)
    List<VersionCount> countGroupByVersion();

    interface VersionCount {
        String getPipelineVersion();
        long getTotal();
    }
}
