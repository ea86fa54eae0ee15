package com.pitwall.config;

import com.pitwall.domain.DataCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "pitwall.preload")
public class PreloadProperties {

    private List<DataCategory> categories = new ArrayList<>(List.of(
            DataCategory.DRIVERS,
            DataCategory.LAPS,
            DataCategory.INTERVALS,
            DataCategory.STINTS
    ));

    private int poolSize = 4;

    private int queueCapacity = 64;

    // 카테고리 1개당 대기 한도
    private Duration timeout = Duration.ofSeconds(45);
}
