package com.infound.creatorportal.server.directory;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemoryCreatorDirectoryTest {

  @Test
  void findSample_matchesOnlyItsOwnUsername() {
    InMemoryCreatorDirectory directory = new InMemoryCreatorDirectory()
        .addSample(new SampleRecord("sample-1", "creator_a"));

    assertThat(directory.findSample("sample-1", "creator_a")).isPresent();
    assertThat(directory.findSample("sample-1", "creator_b")).isEmpty();
    assertThat(directory.findSample("sample-2", "creator_a")).isEmpty();
  }

  @Test
  void toUserInfo_nullContactFields_becomeEmpty() {
    CreatorRecord creator = new CreatorRecord("if-1", "tt-1", "creator_a", "Creator A", null, null);

    assertThat(creator.toUserInfo("42").email()).isEmpty();
    assertThat(creator.toUserInfo("42").whatsapp()).isEmpty();
    assertThat(creator.toUserInfo("42").jti()).isEqualTo("42");
    assertThat(creator.toUserInfo("42").ifId()).isEqualTo("if-1");
  }
}
