package com.example.bookfetch;

import com.example.bookfetch.common.config.AppDownloadProperties;
import com.example.bookfetch.common.config.AppMonitorProperties;
import com.example.bookfetch.common.config.AppOrganizeProperties;
import com.example.bookfetch.common.config.AppQueueProperties;
import com.example.bookfetch.common.config.AppRankingProperties;
import com.example.bookfetch.common.config.AppRequestProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.bookfetch.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppQueueProperties.class,
        AppMonitorProperties.class,
        AppOrganizeProperties.class,
        AppRankingProperties.class,
        AppDownloadProperties.class,
        AppRequestProperties.class
})
public class BookFetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookFetchApplication.class, args);
    }
}
