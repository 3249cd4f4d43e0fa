package com.example.gestureServing.mapper.handler;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import lombok.extern.slf4j.Slf4j;

/**
 * JSON columns (shapes, metrics, landmarks, probs, params) travel as JSON text
 * and surface as {@link JsonNode}.
 */
@Slf4j
@MappedTypes(JsonNode.class)
public class JsonNodeTypeHandler extends BaseTypeHandler<JsonNode> {

  private static final ObjectMapper OM = new ObjectMapper();

  @Override
  public void setNonNullParameter(PreparedStatement ps, int i, JsonNode parameter, JdbcType jdbcType)
      throws SQLException {
    try {
      ps.setString(i, OM.writeValueAsString(parameter));
    } catch (JsonProcessingException e) {
      throw new SQLException("Could not serialize JSON parameter " + i, e);
    }
  }

  @Override
  public JsonNode getNullableResult(ResultSet rs, String columnName) throws SQLException {
    return parse(rs.getString(columnName));
  }

  @Override
  public JsonNode getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
    return parse(rs.getString(columnIndex));
  }

  @Override
  public JsonNode getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
    return parse(cs.getString(columnIndex));
  }

  private JsonNode parse(String raw) {
    if (raw == null) return null;
    try {
      return OM.readTree(raw);
    } catch (JsonProcessingException e) {
      // legacy rows written as plain text: hand them back verbatim
      log.debug("[JSON] column is not valid JSON, returning raw text: {}", e.getOriginalMessage());
      return TextNode.valueOf(raw);
    }
  }
}
