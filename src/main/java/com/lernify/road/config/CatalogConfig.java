package com.lernify.road.config;

import com.lernify.road.catalog.CurriculumCatalog;
import com.lernify.road.catalog.RoadmapContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {
    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public CurriculumCatalog curriculumCatalog() {
        CurriculumCatalog catalog = CurriculumCatalog.build(RoadmapContent.lessons(), RoadmapContent.assessmentBank());
        log.info("Curriculum catalog built with {} domains", catalog.domains().size());
        return catalog;
    }
}
