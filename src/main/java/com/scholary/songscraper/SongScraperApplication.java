package com.scholary.songscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SongScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(SongScraperApplication.class, args);
  }
}
