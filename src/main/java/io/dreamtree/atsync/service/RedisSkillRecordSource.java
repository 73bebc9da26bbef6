package io.dreamtree.atsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dreamtree.atsync.model.SkillRecord;
import io.dreamtree.atsync.model.StoredSkill;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Skills are kept by the workbook as a Redis list of JSON documents at
 * {@code dreamtree:skills:user:<userId>}, appended in the order they were recorded.
 */
@Component
public class RedisSkillRecordSource implements SkillRecordSource {
  private static final Logger log = LoggerFactory.getLogger(RedisSkillRecordSource.class);
  private static final String PREFIX_USER_SKILLS = "dreamtree:skills:user:";

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;

  public RedisSkillRecordSource(StringRedisTemplate redis, ObjectMapper objectMapper) {
    this.redis = redis;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<StoredSkill> findByUserId(String userId) {
    List<String> raw = redis.opsForList().range(PREFIX_USER_SKILLS + userId, 0, -1);
    if (raw == null || raw.isEmpty()) return List.of();
    List<StoredSkill> out = new ArrayList<>(raw.size());
    for (String item : raw) {
      out.add(read(userId, item));
    }
    return out;
  }

  private StoredSkill read(String userId, String item) {
    if (item == null || item.isBlank()) {
      log.warn("empty skill entry for userId={}", userId);
      return StoredSkill.unreadable(null);
    }
    try {
      SkillRecord record = objectMapper.readValue(item, SkillRecord.class);
      if (record != null) return StoredSkill.of(record);
      log.warn("null skill entry for userId={}", userId);
    } catch (JsonProcessingException e) {
      log.warn("unreadable skill entry for userId={}: {}", userId, e.getOriginalMessage());
    }
    return StoredSkill.unreadable(recoverId(item));
  }

  // Best effort: a document with a bad field still names the skill it belongs to.
  private String recoverId(String item) {
    JsonNode id;
    try {
      id = objectMapper.readTree(item).path("id");
    } catch (JsonProcessingException e) {
      return null;
    }
    return id.isTextual() ? id.asText() : null;
  }
}
