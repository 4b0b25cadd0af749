package io.intellixity.catalogq.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.catalogq.jdbc.JdbcQueryExecutor;
import io.intellixity.catalogq.jdbc.compile.SqlCompiler;
import io.intellixity.catalogq.jdbc.error.SqlServerErrorMapper;
import io.intellixity.catalogq.schema.SchemaConfig;
import io.intellixity.catalogq.schema.SchemaConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;

@Configuration
@EnableConfigurationProperties(CatalogqProperties.class)
public class CatalogQueryConfig {
  private static final Logger log = LoggerFactory.getLogger(CatalogQueryConfig.class);

  @Bean
  public SchemaConfig schemaConfig(CatalogqProperties props) throws IOException {
    SchemaConfig cfg = new SchemaConfigLoader().loadResource(props.getSchemaResource());
    log.info("catalogq.schema resource={} aliases={} templates={}",
        props.getSchemaResource(), cfg.schema().aliases(), cfg.templates().names());
    return cfg;
  }

  @Bean
  public SqlCompiler sqlCompiler(SchemaConfig cfg) {
    return new SqlCompiler(cfg.schema(), cfg.templates());
  }

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(CatalogqProperties props) {
    CatalogqProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing catalogq.datasource.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setPoolName("catalogq");
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcQueryExecutor jdbcQueryExecutor(DataSource dataSource) {
    return new JdbcQueryExecutor(dataSource, new SqlServerErrorMapper());
  }
}
