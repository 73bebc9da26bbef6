package io.dreamtree.atsync.service;

import io.dreamtree.atsync.model.StoredSkill;
import java.util.List;

/**
 * Read-only view of the skills a user has recorded locally, in insertion order. Every stored entry
 * is returned, including the ones that cannot be read.
 */
public interface SkillRecordSource {
  List<StoredSkill> findByUserId(String userId);
}
