package io.intellixity.catalogq.examples.web;

import io.intellixity.catalogq.examples.service.QueryResult;
import io.intellixity.catalogq.examples.service.QueryService;
import io.intellixity.catalogq.query.QueryDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Generic query endpoint. {@code {"namedQuery": ..., "payload": ...}} runs against a predefined join template;
 * {@code {"payload": ...}} is a standard request whose payload must name its FROM table.
 */
@RestController
@RequestMapping("/api/query")
public final class QueryController {
  private static final Logger log = LoggerFactory.getLogger(QueryController.class);

  private final QueryService queries;

  public QueryController(QueryService queries) {
    this.queries = queries;
  }

  public record QueryRequest(String namedQuery, QueryDescription payload) {}

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public QueryResponse query(@RequestBody QueryRequest req) {
    String opId = UUID.randomUUID().toString();
    QueryResult r;
    if (req.namedQuery() != null && !req.namedQuery().isBlank()) {
      log.info("catalogq.api op={} kind=predefined namedQuery={}", opId, req.namedQuery());
      r = queries.predefined(req.namedQuery(), req.payload());
    } else {
      log.info("catalogq.api op={} kind=standard from={}", opId,
          req.payload() == null ? null : req.payload().from());
      r = queries.standard(req.payload());
    }
    log.info("catalogq.api op={} rows={}", opId, r.rows().size());
    return QueryResponse.of(r);
  }
}
