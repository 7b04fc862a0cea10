package org.waabox.refwatch.git;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link GitConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GitConfigTest {

  @Test
  void whenReading_givenDefaults_shouldUseTwentySecondTimeout() {
    final GitConfig config = GitConfig.defaults();

    assertEquals(Duration.ofSeconds(20), config.timeout());
    assertFalse(config.username().isPresent());
    assertEquals(Map.of(), config.ssh());
  }

  @Test
  void whenMerging_givenOverrides_shouldOverrideSetValuesAndMergeSsh() {
    // Arrange
    final GitConfig base = GitConfig.builder()
        .timeout(Duration.ofSeconds(60))
        .credentials("ci", "one")
        .ssh(GitConfig.SSH_DIRECTORY, "/home/ci/.ssh")
        .ssh(GitConfig.SSH_KNOWN_HOSTS, "/etc/known_hosts")
        .build();
    final GitConfig overrides = GitConfig.builder()
        .credentials("bot", "two")
        .ssh(GitConfig.SSH_KNOWN_HOSTS, "/tmp/known_hosts")
        .build();

    // Act
    final GitConfig merged = base.merge(overrides);

    // Assert
    assertEquals(Duration.ofSeconds(60), merged.timeout());
    assertEquals("bot", merged.username().orElseThrow());
    assertEquals("two", merged.password().orElseThrow());
    assertEquals("/home/ci/.ssh", merged.ssh().get(GitConfig.SSH_DIRECTORY));
    assertEquals("/tmp/known_hosts",
        merged.ssh().get(GitConfig.SSH_KNOWN_HOSTS));
  }

  @Test
  void whenPrinting_givenCredentials_shouldNotShowPassword() {
    final GitConfig config = GitConfig.builder()
        .credentials("bot", "s3cr3t")
        .build();

    assertFalse(config.toString().contains("s3cr3t"));
  }

  @Test
  void whenBuilding_givenNegativeTimeout_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> GitConfig.builder().timeout(Duration.ofSeconds(-1)));
  }
}
