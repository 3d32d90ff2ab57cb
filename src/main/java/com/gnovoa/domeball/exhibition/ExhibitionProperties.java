package com.gnovoa.domeball.exhibition;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "exhibition")
public record ExhibitionProperties(
        boolean autoStartOnBoot,
        String matchId,
        String homeRoster,
        String awayRoster
) {
    public ExhibitionProperties {
        if (matchId == null || matchId.isBlank()) matchId = "exhibition-1";
        if (homeRoster == null) homeRoster = "classpath:rosters/emberfall-titans.json";
        if (awayRoster == null) awayRoster = "classpath:rosters/shadowmere-wraiths.json";
    }
}
