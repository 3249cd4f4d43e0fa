package com.example.gestureServing.domain;

public record GestureQuery(String userId, int limit) {

  public static final int DEFAULT_LIMIT = 100;

  public static GestureQuery recent() {
    return new GestureQuery(null, DEFAULT_LIMIT);
  }
}
