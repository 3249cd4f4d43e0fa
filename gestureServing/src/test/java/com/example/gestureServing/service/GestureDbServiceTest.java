package com.example.gestureServing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.example.gestureServing.BaseIntegrationTest;
import com.example.gestureServing.domain.GestureQuery;
import com.example.gestureServing.domain.GestureRecord;
import com.example.gestureServing.domain.InferenceResult;
import com.example.gestureServing.domain.NewGesture;
import com.example.gestureServing.exception.InvalidRequestException;
import com.example.gestureServing.exception.UnsupportedRecordOperationException;

@DisplayName("GestureDbService")
class GestureDbServiceTest extends BaseIntegrationTest {

  @Autowired
  private GestureDbService gestures;

  @Nested
  @DisplayName("create")
  class Create {

    @Test
    @DisplayName("stores 21 landmarks and reads them back as JSON")
    void roundTripsLandmarks() {
      long id = gestures.create(new NewGesture(landmarks(21), 42L, "u1", 640, 480, null));

      assertThat(id).isPositive();
      GestureRecord row = gestures.findById(id).orElseThrow();
      assertThat(row.getLandmarks().size()).isEqualTo(21);
      assertThat(row.getLandmarks().get(3).get(0).asDouble()).isCloseTo(0.03, within(1e-9));
      assertThat(row.getLandmarks().get(3).get(1).asDouble()).isCloseTo(0.06, within(1e-9));
      assertThat(row.getSessionId()).isEqualTo(42L);
      assertThat(row.getUserId()).isEqualTo("u1");
      assertThat(row.getFrameWidth()).isEqualTo(640);
      assertThat(row.getSource()).isEqualTo("web");
      assertThat(row.getReceivedAt()).isNotNull();
    }

    @Test
    @DisplayName("inference fields stay empty until attached")
    void noInferenceYet() {
      long id = gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));

      GestureRecord row = gestures.findById(id).orElseThrow();
      assertThat(row.getModelId()).isNull();
      assertThat(row.getPredictedLabel()).isNull();
      assertThat(row.getConfidence()).isNull();
      assertThat(row.getProbs()).isNull();
      assertThat(row.getProcessedAt()).isNull();
    }

    @Test
    @DisplayName("rejects a frame without landmarks")
    void rejectsEmptyLandmarks() {
      assertThatThrownBy(() -> gestures.create(NewGesture.ofLandmarks(List.of(), "u1")))
          .isInstanceOf(InvalidRequestException.class);
      assertThat(countRows("gestures")).isZero();
    }
  }

  @Nested
  @DisplayName("attachInference")
  class AttachInference {

    @Test
    @DisplayName("writes the inference columns together with processed_at")
    void attaches() {
      long id = gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));

      boolean matched = gestures.attachInference(id,
          new InferenceResult(7L, "A", 0.95, Map.of("A", 0.95, "B", 0.05), 12));

      assertThat(matched).isTrue();
      GestureRecord row = gestures.findById(id).orElseThrow();
      assertThat(row.getModelId()).isEqualTo(7L);
      assertThat(row.getPredictedLabel()).isEqualTo("A");
      assertThat(row.getConfidence()).isEqualTo(0.95);
      assertThat(row.getProbs().get("B").asDouble()).isEqualTo(0.05);
      assertThat(row.getProcessingTimeMs()).isEqualTo(12);
      assertThat(row.getProcessedAt()).isNotNull();
    }

    @Test
    @DisplayName("reports an unknown gesture")
    void unknownGesture() {
      assertThat(gestures.attachInference(999, new InferenceResult(7L, "A", 0.5, null, null))).isFalse();
    }

    @Test
    @DisplayName("rejects confidence outside [0, 1]")
    void rejectsConfidence() {
      long id = gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));

      assertThatThrownBy(() -> gestures.attachInference(id, new InferenceResult(7L, "A", 1.5, null, null)))
          .isInstanceOf(InvalidRequestException.class);
      assertThat(gestures.findById(id).orElseThrow().getPredictedLabel()).isNull();
    }

    @Test
    @DisplayName("requires a label")
    void requiresLabel() {
      assertThatThrownBy(() -> gestures.attachInference(1, new InferenceResult(7L, null, 0.5, null, null)))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessageContaining("predicted_label");
    }
  }

  @Nested
  @DisplayName("retrieve")
  class Retrieve {

    @Test
    @DisplayName("filters by user, newest first, capped at the limit")
    void filtersAndCaps() {
      gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));
      gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));
      gestures.create(NewGesture.ofLandmarks(landmarks(21), "u2"));
      gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));

      List<GestureRecord> rows = gestures.retrieve(new GestureQuery("u1", 2));

      assertThat(rows).extracting(GestureRecord::getGestureId).containsExactly(4L, 2L);
      assertThat(rows).extracting(GestureRecord::getUserId).containsOnly("u1");
    }

    @Test
    @DisplayName("without a user lists everyone")
    void allUsers() {
      gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));
      gestures.create(NewGesture.ofLandmarks(landmarks(21), "u2"));

      assertThat(gestures.retrieve(GestureQuery.recent())).hasSize(2);
      assertThat(gestures.retrieve(new GestureQuery(" ", 10))).hasSize(2);
    }

    @Test
    @DisplayName("rejects a non-positive limit")
    void rejectsLimit() {
      assertThatThrownBy(() -> gestures.retrieve(new GestureQuery(null, 0)))
          .isInstanceOf(InvalidRequestException.class);
    }
  }

  @Test
  @DisplayName("delete removes the row once")
  void deletes() {
    long id = gestures.create(NewGesture.ofLandmarks(landmarks(21), "u1"));

    assertThat(gestures.delete(id)).isTrue();
    assertThat(gestures.delete(id)).isFalse();
    assertThat(gestures.findById(id)).isEmpty();
  }

  @Test
  @DisplayName("generic updates are not supported")
  void updateUnsupported() {
    assertThatThrownBy(() -> gestures.update(1, Map.of("user_id", "u9")))
        .isInstanceOf(UnsupportedRecordOperationException.class);
  }
}
