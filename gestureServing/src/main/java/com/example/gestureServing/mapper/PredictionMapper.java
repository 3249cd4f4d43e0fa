package com.example.gestureServing.mapper;

import java.util.List;

import org.apache.ibatis.annotations.*;

import com.example.gestureServing.domain.PredictionRecord;

@Mapper
public interface PredictionMapper {

  @Insert("""
      INSERT INTO predictions
        (requestor_user_id, session_id, model_id, status, params, created_at)
      VALUES
        (#{requestorUserId}, #{sessionId}, #{modelId}, #{status}, #{params}, CURRENT_TIMESTAMP)
      """)
  @Options(useGeneratedKeys = true, keyProperty = "predictionId", keyColumn = "prediction_id")
  int insert(PredictionRecord prediction);

  // both transitions only fire from 'queued'
  @Update("""
      UPDATE predictions
      SET status = 'succeeded',
          output_text = #{outputText},
          confidence = #{confidence},
          latency_ms = #{latencyMs},
          completed_at = CURRENT_TIMESTAMP
      WHERE prediction_id = #{predictionId} AND status = 'queued'
      """)
  int markSucceeded(@Param("predictionId") long predictionId,
                    @Param("outputText") String outputText,
                    @Param("confidence") Double confidence,
                    @Param("latencyMs") Integer latencyMs);

  @Update("""
      UPDATE predictions
      SET status = 'failed',
          error_message = #{errorMessage},
          completed_at = CURRENT_TIMESTAMP
      WHERE prediction_id = #{predictionId} AND status = 'queued'
      """)
  int markFailed(@Param("predictionId") long predictionId,
                 @Param("errorMessage") String errorMessage);

  @Select("""
      SELECT status
      FROM predictions
      WHERE prediction_id = #{predictionId}
      """)
  String findStatus(@Param("predictionId") long predictionId);

  @Select("""
      <script>
      SELECT *
      FROM predictions
      <where>
        <if test="sessionId != null">session_id = #{sessionId}</if>
      </where>
      ORDER BY created_at DESC, prediction_id DESC
      LIMIT #{limit}
      </script>
      """)
  List<PredictionRecord> findRecent(@Param("sessionId") Long sessionId, @Param("limit") int limit);

  @Select("""
      SELECT *
      FROM predictions
      WHERE prediction_id = #{predictionId}
      """)
  PredictionRecord findById(@Param("predictionId") long predictionId);

  @Delete("""
      DELETE FROM predictions
      WHERE prediction_id = #{predictionId}
      """)
  int deleteById(@Param("predictionId") long predictionId);
}
