package com.scholary.videodigest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoDigestApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoDigestApplication.class, args);
  }
}
