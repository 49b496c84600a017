package io.b2mash.realtime.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class TenantMigrationsTest {

  @Test
  void partitionName_usesUnderscoredDate() {
    assertThat(TenantMigrations.partitionName(LocalDate.of(2026, 3, 7)))
        .isEqualTo("messages_2026_03_07");
  }
}
