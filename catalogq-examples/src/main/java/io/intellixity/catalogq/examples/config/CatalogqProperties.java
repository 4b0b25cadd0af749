package io.intellixity.catalogq.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalogq")
public class CatalogqProperties {
  /** Classpath resource holding tables and join templates. */
  private String schemaResource = "catalog-schema.json";
  private final Datasource datasource = new Datasource();

  public String getSchemaResource() { return schemaResource; }
  public void setSchemaResource(String schemaResource) { this.schemaResource = schemaResource; }
  public Datasource getDatasource() { return datasource; }

  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }
}
