package com.herzen.metrics;

import com.herzen.metrics.coverage.CoverageResolver;
import com.herzen.metrics.domain.MetricModels.Coverage;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.error.UnknownItemException;
import com.herzen.metrics.service.ContentCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CoverageResolverTest {
    @Mock
    private ContentCatalogService catalog;

    private CoverageResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CoverageResolver(catalog);
        when(catalog.version()).thenReturn(1L);
        when(catalog.itemIdsAtLevel(Level.LESSON)).thenReturn(Set.of("l1", "l2", "l3"));
    }

    @Test
    @DisplayName("all: every item at the level")
    void allReturnsEveryItemAtLevel() {
        assertEquals(Set.of("l1", "l2", "l3"), resolver.resolve(Level.LESSON, Coverage.all()));
    }

    @Test
    @DisplayName("include: exactly the listed items")
    void includeReturnsListedItems() {
        Set<String> resolved = resolver.resolve(Level.LESSON, Coverage.fromArray(List.of("include", "l1", "l3")));
        assertEquals(Set.of("l1", "l3"), resolved);
    }

    @Test
    @DisplayName("include: unknown ids fail with UnknownItem")
    void includeWithUnknownIdFails() {
        UnknownItemException ex = assertThrows(UnknownItemException.class,
                () -> resolver.resolve(Level.LESSON, Coverage.fromArray(List.of("include", "l1", "ghost"))));
        assertEquals(Set.of("ghost"), ex.itemIds());
    }

    @Test
    @DisplayName("exclude: unknown ids are ignored")
    void excludeIgnoresUnknownIds() {
        Set<String> resolved = resolver.resolve(Level.LESSON, Coverage.fromArray(List.of("exclude", "l2", "ghost")));
        assertEquals(Set.of("l1", "l3"), resolved);
    }

    @Test
    void resultIsCachedUntilCatalogVersionChanges() {
        resolver.resolve(Level.LESSON, Coverage.all());
        resolver.resolve(Level.LESSON, Coverage.all());
        verify(catalog, times(1)).itemIdsAtLevel(Level.LESSON);

        doReturn(2L).when(catalog).version();
        doReturn(Set.of("l1")).when(catalog).itemIdsAtLevel(Level.LESSON);
        assertEquals(Set.of("l1"), resolver.resolve(Level.LESSON, Coverage.all()));
        verify(catalog, times(2)).itemIdsAtLevel(Level.LESSON);
    }
}
