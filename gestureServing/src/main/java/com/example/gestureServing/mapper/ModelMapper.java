package com.example.gestureServing.mapper;

import java.util.List;

import org.apache.ibatis.annotations.*;

import com.example.gestureServing.domain.ModelRecord;

@Mapper
public interface ModelMapper {

  @Insert("""
      INSERT INTO models
        (name, version, model_type, artifact_uri, input_shape, output_shape, status, metrics, sha256)
      VALUES
        (#{name}, #{version}, #{modelType}, #{artifactUri}, #{inputShape}, #{outputShape},
         #{status}, #{metrics}, #{sha256})
      """)
  @Options(useGeneratedKeys = true, keyProperty = "modelId", keyColumn = "model_id")
  int insert(ModelRecord model);

  @Select("""
      SELECT *
      FROM models
      ORDER BY created_at DESC, model_id DESC
      """)
  List<ModelRecord> findAll();

  @Select("""
      SELECT *
      FROM models
      WHERE model_id = #{modelId}
      """)
  ModelRecord findById(@Param("modelId") long modelId);

  @Select("""
      SELECT COUNT(*)
      FROM models
      WHERE status = #{status}
      """)
  int countByStatus(@Param("status") String status);

  @Delete("""
      DELETE FROM models
      WHERE model_id = #{modelId}
      """)
  int deleteById(@Param("modelId") long modelId);
}
