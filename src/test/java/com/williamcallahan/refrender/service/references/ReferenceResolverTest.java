package com.williamcallahan.refrender.service.references;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.refrender.domain.references.ProjectDirectory;
import com.williamcallahan.refrender.domain.references.ReferableObject;
import com.williamcallahan.refrender.domain.references.ReferenceMatch;
import com.williamcallahan.refrender.domain.references.ReferenceObjectSource;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.ResolvedProject;
import com.williamcallahan.refrender.testsupport.InMemoryReferenceStore;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies project and object resolution, including silent failures and propagated store errors.
 */
class ReferenceResolverTest {

    private static final ResolvedProject AMBIENT = new ResolvedProject(1, "group/app");
    private static final ResolvedProject FOREIGN = new ResolvedProject(2, "group/lib");

    private ProjectDirectory projectDirectory;
    private ReferenceObjectSource source;
    private ReferenceType type;
    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        projectDirectory = mock(ProjectDirectory.class);
        source = mock(ReferenceObjectSource.class);
        type = new ReferenceType("merge_request", "Merge Request", InMemoryReferenceStore.MERGE_REQUEST_SHORT, null, source);
        resolver = new ReferenceResolver(projectDirectory);
    }

    @Test
    void resolvesAmbientReferenceWithoutConsultingTheDirectory() {
        ReferableObject object = new InMemoryReferenceStore.StoredObject(100, 42, AMBIENT, "Add cache");
        when(source.findObject(AMBIENT, 42)).thenReturn(Optional.of(object));

        Optional<ReferenceResolver.Resolution> resolution =
            resolver.resolve(match("!42", null, 42), type, AMBIENT, new RequestReferenceCache());

        assertTrue(resolution.isPresent());
        assertSame(object, resolution.get().object());
        assertEquals(AMBIENT, resolution.get().project());
        verify(projectDirectory, never()).findByReference(any());
    }

    @Test
    void resolvesForeignProjectThroughTheCache() {
        ReferableObject object = new InMemoryReferenceStore.StoredObject(200, 3, FOREIGN, "Bump");
        when(projectDirectory.findByReference("group/lib")).thenReturn(Optional.of(FOREIGN));
        when(source.findObject(FOREIGN, 3)).thenReturn(Optional.of(object));
        RequestReferenceCache cache = new RequestReferenceCache();

        resolver.resolve(match("group/lib!3", "group/lib", 3), type, AMBIENT, cache);
        Optional<ReferenceResolver.Resolution> again =
            resolver.resolve(match("group/lib!3", "group/lib", 3), type, AMBIENT, cache);

        assertEquals(FOREIGN, again.orElseThrow().project());
        verify(projectDirectory, times(1)).findByReference("group/lib");
        verify(source, times(1)).findObject(FOREIGN, 3);
    }

    @Test
    void unknownProjectResolvesToNothing() {
        when(projectDirectory.findByReference("nobody/here")).thenReturn(Optional.empty());

        Optional<ReferenceResolver.Resolution> resolution =
            resolver.resolve(match("nobody/here!1", "nobody/here", 1), type, AMBIENT, new RequestReferenceCache());

        assertTrue(resolution.isEmpty());
        verify(source, never()).findObject(any(), anyLong());
    }

    @Test
    void unknownObjectResolvesToNothing() {
        when(source.findObject(AMBIENT, 9)).thenReturn(Optional.empty());

        assertTrue(resolver.resolve(match("!9", null, 9), type, AMBIENT, new RequestReferenceCache()).isEmpty());
    }

    @Test
    void storeFailuresPropagate() {
        when(source.findObject(AMBIENT, 5)).thenThrow(new IllegalStateException("store offline"));

        IllegalStateException failure = assertThrows(
            IllegalStateException.class,
            () -> resolver.resolve(match("!5", null, 5), type, AMBIENT, ReferenceCache.disabled()));
        assertEquals("store offline", failure.getMessage());
    }

    private static ReferenceMatch match(String text, String projectToken, long id) {
        return new ReferenceMatch(text, 0, text.length(), id, projectToken, null, null, Map.of());
    }
}
