package com.gnovoa.domeball;

import com.gnovoa.domeball.exhibition.ExhibitionProperties;
import com.gnovoa.domeball.rosters.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties({EngineProperties.class, ExhibitionProperties.class})
public class DomeBallApplication {

  public static void main(String[] args) {
    SpringApplication.run(DomeBallApplication.class, args);
  }
}
