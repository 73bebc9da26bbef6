package io.dreamtree.atsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A user's skill as held locally. Only {@code id} and {@code name} are required; the rest is
 * copied into the published record when present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillRecord(
    String id,
    String name,
    String category,
    String skillId,
    Integer mastery,
    Integer rank,
    String evidence,
    String createdAt,
    String updatedAt) {

  public SkillRecord(String id, String name, String category) {
    this(id, name, category, null, null, null, null, null, null);
  }
}
