package io.dreamtree.atsync.atproto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dreamtree.atsync.atproto.model.Connection;
import io.dreamtree.atsync.atproto.model.ConnectionStatus;
import io.dreamtree.atsync.support.AtprotoTestSupport;
import io.dreamtree.atsync.support.InMemoryRedis;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStoreTest {
  private InMemoryRedis redis;
  private SessionCipher cipher;
  private SessionStore store;

  @BeforeEach
  void setUp() {
    redis = new InMemoryRedis();
    cipher = new SessionCipher(AtprotoTestSupport.properties());
    store = new SessionStore(redis.template(), new ObjectMapper(), cipher);
  }

  @Test
  void savedConnectionIsEncryptedAtRest() {
    store.save("user-1", connection("user-1", "alice.example.com"));

    String raw = redis.value("atproto:connection:user-1");
    assertFalse(raw.contains("access-token-1"));
    assertFalse(raw.contains("alice.example.com"));

    Connection loaded = store.get("user-1").orElseThrow();
    assertEquals("did:plc:alice", loaded.did());
    assertEquals("access-token-1", loaded.accessToken());
    assertEquals("refresh-token-1", loaded.refreshToken());
  }

  @Test
  void statusNeverCarriesTokens() {
    store.save("user-1", connection("user-1", "alice.example.com"));
    store.markSynced("user-1", 1_760_000_000_000L);

    ConnectionStatus status = store.status("user-1");

    assertTrue(status.connected());
    assertEquals("alice.example.com", status.handle());
    assertEquals("did:plc:alice", status.did());
    assertEquals(1_700_000_000_000L, status.connectedAt());
    assertEquals(1_760_000_000_000L, status.lastSyncAt());
    assertTrue(status.syncEnabled());
    assertFalse(status.toString().contains("access-token-1"));
  }

  @Test
  void saveOverwritesPreviousConnection() {
    store.save("user-1", connection("user-1", "alice.example.com"));
    store.save("user-1", connection("user-1", "alice.bsky.social"));

    assertEquals("alice.bsky.social", store.status("user-1").handle());
  }

  @Test
  void deleteRemovesConnectionAndSyncBookkeeping() {
    store.save("user-1", connection("user-1", "alice.example.com"));
    store.markSynced("user-1", 1L);

    store.delete("user-1");

    assertFalse(store.status("user-1").connected());
    assertNull(store.status("user-1").lastSyncAt());
    assertFalse(redis.containsKey("atproto:connection:lastsync:user-1"));
  }

  @Test
  void syncFlagSurvivesReconnectButNotDelete() {
    store.save("user-1", connection("user-1", "alice.example.com"));

    ConnectionStatus off = store.setSyncEnabled("user-1", false);
    store.save("user-1", connection("user-1", "alice.bsky.social"));

    assertFalse(off.syncEnabled());
    assertFalse(store.status("user-1").syncEnabled());

    store.delete("user-1");
    store.save("user-1", connection("user-1", "alice.example.com"));

    assertTrue(store.status("user-1").syncEnabled());
    assertTrue(store.setSyncEnabled("user-1", false).connected());
    assertTrue(store.setSyncEnabled("user-1", true).syncEnabled());
  }

  @Test
  void syncFlagIsNotWrittenWithoutConnection() {
    ConnectionStatus status = store.setSyncEnabled("user-1", false);

    assertFalse(status.connected());
    assertFalse(status.syncEnabled());
    assertEquals(0, redis.valueCount());
  }

  @Test
  void unknownUserIsDisconnected() {
    assertEquals(ConnectionStatus.disconnected(), store.status("nobody"));
    assertEquals(Optional.empty(), store.get("nobody"));
  }

  @Test
  void saveRejectsConnectionOfAnotherUser() {
    assertThrows(
        IllegalArgumentException.class,
        () -> store.save("user-1", connection("user-2", "bob.example.com")));
  }

  @Test
  void blobStoredUnderWrongUserIsIgnored() {
    store.save("user-2", connection("user-2", "bob.example.com"));
    redis.put("atproto:connection:user-1", redis.value("atproto:connection:user-2"));

    assertFalse(store.get("user-1").isPresent());
  }

  @Test
  void undecryptableBlobIsTreatedAsAbsent() {
    redis.put("atproto:connection:user-1", "garbage");

    assertFalse(store.status("user-1").connected());
  }

  private static Connection connection(String userId, String handle) {
    return new Connection(
        userId,
        "did:plc:" + (userId.equals("user-1") ? "alice" : "bob"),
        handle,
        "https://pds.example",
        "access-token-1",
        "refresh-token-1",
        1_700_000_000_000L);
  }
}
