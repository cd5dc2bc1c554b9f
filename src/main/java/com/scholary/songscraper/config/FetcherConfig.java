package com.scholary.songscraper.config;

import com.scholary.songscraper.fetch.FetcherProperties;
import com.scholary.songscraper.fetch.HttpSongFetcher;
import com.scholary.songscraper.fetch.SongFetcher;
import com.scholary.songscraper.fetch.SongPageParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for fetching song pages and audio. */
@Configuration
@EnableConfigurationProperties(FetcherProperties.class)
public class FetcherConfig {

  @Bean
  public SongFetcher songFetcher(FetcherProperties properties) {
    return new HttpSongFetcher(properties, new SongPageParser());
  }
}
