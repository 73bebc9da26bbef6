package io.dreamtree.atsync.model;

/**
 * One entry of a user's local skill list. An entry that could not be read keeps whatever id could
 * be recovered from it and has no {@link SkillRecord}.
 */
public record StoredSkill(String recordId, SkillRecord record) {

  public static StoredSkill of(SkillRecord record) {
    return new StoredSkill(record.id(), record);
  }

  public static StoredSkill unreadable(String recordId) {
    return new StoredSkill(recordId, null);
  }

  public boolean isReadable() {
    return record != null;
  }
}
