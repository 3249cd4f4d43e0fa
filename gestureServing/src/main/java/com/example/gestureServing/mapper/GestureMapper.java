package com.example.gestureServing.mapper;

import java.util.List;

import org.apache.ibatis.annotations.*;

import com.example.gestureServing.domain.GestureRecord;

@Mapper
public interface GestureMapper {

  @Insert("""
      INSERT INTO gestures
        (session_id, user_id, landmarks, frame_width, frame_height, source, received_at)
      VALUES
        (#{sessionId}, #{userId}, #{landmarks}, #{frameWidth}, #{frameHeight}, #{source}, #{receivedAt})
      """)
  @Options(useGeneratedKeys = true, keyProperty = "gestureId", keyColumn = "gesture_id")
  int insert(GestureRecord gesture);

  /** Inference columns only; processed_at comes from the database clock. */
  @Update("""
      UPDATE gestures
      SET model_id = #{modelId},
          predicted_label = #{predictedLabel},
          confidence = #{confidence},
          probs = #{probs},
          processing_time_ms = #{processingTimeMs},
          processed_at = CURRENT_TIMESTAMP
      WHERE gesture_id = #{gestureId}
      """)
  int attachInference(GestureRecord inference);

  @Select("""
      <script>
      SELECT *
      FROM gestures
      <where>
        <if test="userId != null">user_id = #{userId}</if>
      </where>
      ORDER BY received_at DESC, gesture_id DESC
      LIMIT #{limit}
      </script>
      """)
  List<GestureRecord> findRecent(@Param("userId") String userId, @Param("limit") int limit);

  @Select("""
      SELECT *
      FROM gestures
      WHERE gesture_id = #{gestureId}
      """)
  GestureRecord findById(@Param("gestureId") long gestureId);

  @Delete("""
      DELETE FROM gestures
      WHERE gesture_id = #{gestureId}
      """)
  int deleteById(@Param("gestureId") long gestureId);
}
