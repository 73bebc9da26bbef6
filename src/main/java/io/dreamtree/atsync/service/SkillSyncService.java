package io.dreamtree.atsync.service;

import io.dreamtree.atsync.atproto.AtprotoErrorCode;
import io.dreamtree.atsync.atproto.AtprotoException;
import io.dreamtree.atsync.atproto.AtprotoMetrics;
import io.dreamtree.atsync.atproto.AtprotoProperties;
import io.dreamtree.atsync.atproto.AtprotoUtils;
import io.dreamtree.atsync.atproto.SessionStore;
import io.dreamtree.atsync.atproto.model.Connection;
import io.dreamtree.atsync.client.PdsRecordClient;
import io.dreamtree.atsync.client.PdsRequestException;
import io.dreamtree.atsync.model.SkillRecord;
import io.dreamtree.atsync.model.StoredSkill;
import io.dreamtree.atsync.model.SyncFailure;
import io.dreamtree.atsync.model.SyncResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pushes every local skill of a user to their PDS as {@code com.dreamtree.skill} records.
 *
 * <p>Records are written one at a time in source order. Each record key is derived from the
 * local id, so a second run updates the records the first one created. A failing record is
 * reported in the result and the run moves on; nothing is retried. Stored entries that cannot be
 * read count as attempted and failed.
 */
@Service
public class SkillSyncService {
  private static final Logger log = LoggerFactory.getLogger(SkillSyncService.class);
  static final String UNREADABLE_RECORD = "unreadable local record";

  private final SessionStore sessionStore;
  private final SkillRecordSource recordSource;
  private final PdsRecordClient recordClient;
  private final AtprotoProperties properties;
  private final AtprotoMetrics metrics;

  public SkillSyncService(
      SessionStore sessionStore,
      SkillRecordSource recordSource,
      PdsRecordClient recordClient,
      AtprotoProperties properties,
      AtprotoMetrics metrics) {
    this.sessionStore = sessionStore;
    this.recordSource = recordSource;
    this.recordClient = recordClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  public SyncResult syncAll(String userId) {
    Connection connection =
        sessionStore
            .get(userId)
            .orElseThrow(
                () ->
                    new AtprotoException(
                        AtprotoErrorCode.NOT_CONNECTED, "not connected to AT Protocol", 400));

    String collection = properties.getSync().getCollection();
    List<StoredSkill> entries = recordSource.findByUserId(userId);
    List<SyncFailure> failures = new ArrayList<>();
    int created = 0;
    int updated = 0;

    for (StoredSkill entry : entries) {
      if (entry == null || !entry.isReadable()) {
        String recordId = entry == null ? null : entry.recordId();
        log.info(
            "skill sync skipped userId={} recordId={}: {}", userId, recordId, UNREADABLE_RECORD);
        failures.add(new SyncFailure(recordId, UNREADABLE_RECORD));
        metrics.syncRecord("failed");
        continue;
      }
      SkillRecord record = entry.record();
      try {
        String rkey = AtprotoUtils.recordKeyFor(record.id());
        Map<String, Object> value = toPdsRecord(collection, record);
        if (recordClient.recordExists(connection, collection, rkey)) {
          recordClient.putRecord(connection, collection, rkey, value);
          updated++;
          metrics.syncRecord("updated");
        } else {
          recordClient.createRecord(connection, collection, rkey, value);
          created++;
          metrics.syncRecord("created");
        }
      } catch (Exception e) {
        String reason = describeFailure(e);
        log.info("skill sync failed userId={} recordId={}: {}", userId, record.id(), reason);
        failures.add(new SyncFailure(record.id(), reason));
        metrics.syncRecord("failed");
      }
    }

    long syncedAt = Instant.now().toEpochMilli();
    sessionStore.markSynced(userId, syncedAt);
    int succeeded = created + updated;
    log.info(
        "skill sync finished userId={} attempted={} created={} updated={} failed={}",
        userId,
        entries.size(),
        created,
        updated,
        failures.size());
    return new SyncResult(
        entries.size(), succeeded, failures.size(), created, updated, List.copyOf(failures), syncedAt);
  }

  static Map<String, Object> toPdsRecord(String collection, SkillRecord record) {
    if (record.name() == null || record.name().isBlank()) {
      throw new IllegalArgumentException("skill name required");
    }
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("$type", collection);
    value.put("skillName", record.name());
    putIfPresent(value, "skillId", record.skillId());
    putIfPresent(value, "category", record.category());
    putIfPresent(value, "mastery", record.mastery());
    putIfPresent(value, "rank", record.rank());
    putIfPresent(value, "evidence", record.evidence());
    value.put(
        "createdAt",
        record.createdAt() == null || record.createdAt().isBlank()
            ? Instant.now().toString()
            : record.createdAt());
    putIfPresent(value, "updatedAt", record.updatedAt());
    value.put("dreamtreeId", record.id());
    return value;
  }

  private static void putIfPresent(Map<String, Object> value, String key, Object field) {
    if (field == null) return;
    if (field instanceof String s && s.isBlank()) return;
    value.put(key, field);
  }

  static String describeFailure(Exception e) {
    if (e instanceof PdsRequestException pds) {
      StringBuilder sb = new StringBuilder(pds.getMethod());
      if (pds.getStatus() > 0) {
        sb.append(" returned ").append(pds.getStatus());
      } else {
        sb.append(" unavailable");
      }
      if (pds.getError() != null) sb.append(" (").append(pds.getError()).append(')');
      return sb.toString();
    }
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
