package alertmigrator.datasource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CachingDatasourceLookupTest {

    private static final Datasource PROM = new Datasource(3, "prom", "Prometheus", Datasource.TYPE_PROMETHEUS);

    private DatasourceLookup delegate;
    private CachingDatasourceLookup lookup;

    @BeforeEach
    void setUp() {
        delegate = mock(DatasourceLookup.class);
        lookup = new CachingDatasourceLookup(delegate);
    }

    @Test
    void hitsAreCached() {
        when(delegate.byId(1, 3)).thenReturn(Optional.of(PROM));

        assertThat(lookup.byId(1, 3)).contains(PROM);
        assertThat(lookup.byId(1, 3)).contains(PROM);

        verify(delegate, times(1)).byId(1, 3);
    }

    @Test
    void missesAreCached() {
        when(delegate.byUid(1, "gone")).thenReturn(Optional.empty());

        assertThat(lookup.byUid(1, "gone")).isEmpty();
        assertThat(lookup.byUid(1, "gone")).isEmpty();

        verify(delegate, times(1)).byUid(1, "gone");
    }

    @Test
    void organizationsAreKeptApart() {
        when(delegate.byId(1, 3)).thenReturn(Optional.of(PROM));
        when(delegate.byId(2, 3)).thenReturn(Optional.empty());

        assertThat(lookup.byId(1, 3)).isPresent();
        assertThat(lookup.byId(2, 3)).isEmpty();
    }

    @Test
    void nullAnswerIsAMiss() {
        when(delegate.byId(1, 3)).thenReturn(null);
        when(delegate.byUid(1, "prom")).thenReturn(null);

        assertThat(lookup.byId(1, 3)).isEmpty();
        assertThat(lookup.byUid(1, "prom")).isEmpty();
        assertThat(lookup.byId(1, 3)).isEmpty();

        verify(delegate, times(1)).byId(1, 3);
    }

    @Test
    void emptyUidIsNeverLookedUp() {
        assertThat(lookup.byUid(1, "")).isEmpty();
        assertThat(lookup.byUid(1, null)).isEmpty();

        verify(delegate, never()).byUid(anyLong(), any());
    }
}
