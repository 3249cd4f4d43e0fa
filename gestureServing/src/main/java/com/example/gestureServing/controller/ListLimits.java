package com.example.gestureServing.controller;

import org.springframework.stereotype.Component;

import com.example.gestureServing.config.ServingProperties;
import com.example.gestureServing.exception.InvalidRequestException;

/**
 * Resolves the ?limit= of list endpoints: default when absent, capped at the
 * configured maximum, rejected when not positive.
 */
@Component
public class ListLimits {

  private final ServingProperties props;

  public ListLimits(ServingProperties props) {
    this.props = props;
  }

  public int resolve(Integer requested) {
    if (requested == null) return props.getDefaultListLimit();
    if (requested < 1) throw new InvalidRequestException("limit must be positive");
    return Math.min(requested, props.getMaxListLimit());
  }
}
