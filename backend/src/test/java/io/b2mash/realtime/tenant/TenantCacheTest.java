package io.b2mash.realtime.tenant;

import static io.b2mash.realtime.TestFixtures.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.realtime.TestFixtures;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TenantCacheTest {

  @Mock private TenantRepository tenantRepository;

  private TenantCache cache;

  @BeforeEach
  void setUp() {
    cache = new TenantCache(tenantRepository, TestFixtures.properties());
  }

  @Test
  void getTenant_readsRepositoryOnce() {
    when(tenantRepository.findByExternalId("t1")).thenReturn(Optional.of(tenant("t1")));

    assertThat(cache.getTenant("t1")).isPresent();
    assertThat(cache.getTenant("t1")).isPresent();

    verify(tenantRepository, times(1)).findByExternalId("t1");
  }

  @Test
  void getTenant_doesNotCacheMisses() {
    when(tenantRepository.findByExternalId("t1"))
        .thenReturn(Optional.empty())
        .thenReturn(Optional.of(tenant("t1")));

    assertThat(cache.getTenant("t1")).isEmpty();
    assertThat(cache.getTenant("t1")).isPresent();
  }

  @Test
  void invalidate_forcesReload() {
    when(tenantRepository.findByExternalId("t1"))
        .thenReturn(Optional.of(tenant("t1")))
        .thenReturn(Optional.of(tenant("t1", true)));

    assertThat(cache.getTenant("t1").orElseThrow().suspended()).isFalse();
    cache.invalidate("t1");

    assertThat(cache.getTenant("t1").orElseThrow().suspended()).isTrue();
  }
}
