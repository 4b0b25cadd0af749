package io.intellixity.catalogq.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/** Writes a {@link QueryDescription} in the format read by {@link QueryDescriptionJsonDeserializer}. */
public final class QueryDescriptionJsonSerializer extends JsonSerializer<QueryDescription> {
  @Override
  public void serialize(QueryDescription q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeArrayFieldStart("select");
    for (String s : q.select()) g.writeString(s);
    g.writeEndArray();

    if (q.from() != null) {
      g.writeObjectFieldStart("from");
      g.writeStringField("table", q.from().table());
      if (q.from().alias() != null) g.writeStringField("alias", q.from().alias());
      g.writeEndObject();
    }

    if (q.hasJoins()) {
      g.writeArrayFieldStart("joins");
      for (JoinClause j : q.joins()) {
        g.writeStartObject();
        g.writeStringField("type", j.kind().sql());
        g.writeStringField("table", j.table());
        if (j.alias() != null) g.writeStringField("alias", j.alias());
        g.writeFieldName("on");
        writeNode(j.on(), g, serializers, "joinCondOp");
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.where() != null) {
      g.writeFieldName("where");
      writeNode(q.where(), g, serializers, "whereCondOp");
    }

    if (!q.orderBy().isEmpty()) {
      g.writeArrayFieldStart("orderBy");
      for (SortKey sk : q.orderBy()) {
        g.writeStartObject();
        g.writeStringField("key", sk.target());
        g.writeStringField("direction", sk.direction().name().toLowerCase(Locale.ROOT));
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() != null) g.writeNumberField("offset", q.offset());
    g.writeEndObject();
  }

  private static void writeNode(ConditionNode node, JsonGenerator g, SerializerProvider serializers,
                                String groupOpField) throws IOException {
    try {
      node.accept(nodeWriter(g, serializers, groupOpField));
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private static ConditionVisitor<Void> nodeWriter(JsonGenerator g, SerializerProvider serializers,
                                                   String groupOpField) {
    return new ConditionVisitor<>() {
      @Override
      public Void visit(Condition c) {
        try {
          g.writeStartObject();
          g.writeStringField("key", c.target());
          g.writeStringField("whereCondOp", c.operator().sql());
          if (c.operator().takesValue()) {
            g.writeFieldName("val");
            serializers.defaultSerializeValue(c.value(), g);
          }
          g.writeEndObject();
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
        return null;
      }

      @Override
      public Void visit(JoinColumnCondition c) {
        try {
          g.writeStartObject();
          g.writeStringField("columnA", c.left());
          g.writeStringField("op", c.operator().sql());
          g.writeStringField("columnB", c.right());
          g.writeEndObject();
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
        return null;
      }

      @Override
      public Void visit(ConditionGroup group) {
        try {
          g.writeStartObject();
          g.writeStringField(groupOpField, group.combinator().name());
          g.writeArrayFieldStart("conditions");
          for (ConditionNode child : group.children()) writeNode(child, g, serializers, groupOpField);
          g.writeEndArray();
          g.writeEndObject();
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
        return null;
      }
    };
  }
}
