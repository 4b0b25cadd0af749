package io.intellixity.catalogq.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class CatalogQueryApplication {
  public static void main(String[] args) {
    SpringApplication.run(CatalogQueryApplication.class, args);
  }
}
