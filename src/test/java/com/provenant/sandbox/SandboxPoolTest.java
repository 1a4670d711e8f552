package com.provenant.sandbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SandboxPoolTest {

    @TempDir
    Path tempDir;

    private BuildRequest request(String builderId) throws Exception {
        Path outputDir = Files.createDirectory(tempDir.resolve(builderId + "-out"));
        Files.writeString(outputDir.resolve("app.apk"), "bytes");
        return new BuildRequest("job-1", builderId, 0, "img", List.of(), Map.of(), outputDir, List.of(), 1024, 1);
    }

    @Test
    void acquireOpensSandboxOnRequestedNode() throws Exception {
        SandboxProvider a = mock(SandboxProvider.class);
        SandboxProvider b = mock(SandboxProvider.class);
        when(b.openSandbox(any())).thenReturn("sbx-b");
        SandboxPool pool = new SandboxPool(List.of(new BuilderNode("builder-a", a), new BuilderNode("builder-b", b)));

        try (SandboxLease lease = pool.acquire(request("builder-b"))) {
            assertEquals("sbx-b", lease.sandboxId());
            assertEquals("builder-b", lease.builderId());
        }
        verifyNoInteractions(a);
    }

    @Test
    void closingLeaseTearsDownAndDeletesOutput() throws Exception {
        SandboxProvider provider = mock(SandboxProvider.class);
        when(provider.openSandbox(any())).thenReturn("sbx-1");
        SandboxPool pool = new SandboxPool(List.of(new BuilderNode("builder-a", provider)));
        BuildRequest request = request("builder-a");

        SandboxLease lease = pool.acquire(request);
        lease.close();
        lease.close();

        assertTrue(lease.isClosed());
        assertFalse(Files.exists(request.outputDir()));
        verify(provider, times(1)).teardownSandbox("sbx-1");
    }

    @Test
    void teardownFailureStillDeletesOutput() throws Exception {
        SandboxProvider provider = mock(SandboxProvider.class);
        when(provider.openSandbox(any())).thenReturn("sbx-1");
        doThrow(new SandboxException("daemon gone")).when(provider).teardownSandbox("sbx-1");
        SandboxPool pool = new SandboxPool(List.of(new BuilderNode("builder-a", provider)));
        BuildRequest request = request("builder-a");

        assertDoesNotThrow(() -> pool.acquire(request).close());
        assertFalse(Files.exists(request.outputDir()));
    }

    @Test
    void failedOpenCleansOutputDirectory() throws Exception {
        SandboxProvider provider = mock(SandboxProvider.class);
        when(provider.openSandbox(any())).thenThrow(new SandboxException("image missing"));
        SandboxPool pool = new SandboxPool(List.of(new BuilderNode("builder-a", provider)));
        BuildRequest request = request("builder-a");

        assertThrows(SandboxException.class, () -> pool.acquire(request));
        assertFalse(Files.exists(request.outputDir()));
    }

    @Test
    void unknownNodeIsRejected() throws Exception {
        SandboxPool pool = new SandboxPool(List.of(new BuilderNode("builder-a", mock(SandboxProvider.class))));
        BuildRequest request = request("builder-z");

        assertThrows(SandboxException.class, () -> pool.acquire(request));
    }

    @Test
    void duplicateNodeIdsAreRejected() {
        SandboxProvider provider = mock(SandboxProvider.class);
        assertThrows(IllegalArgumentException.class, () -> new SandboxPool(List.of(
                new BuilderNode("builder-a", provider), new BuilderNode("builder-a", provider))));
    }

    @Test
    void reportsNodesInConfiguredOrderWithAvailability() {
        SandboxProvider up = mock(SandboxProvider.class);
        SandboxProvider down = mock(SandboxProvider.class);
        when(up.isAvailable()).thenReturn(true);
        when(down.isAvailable()).thenReturn(false);
        SandboxPool pool = new SandboxPool(List.of(
                new BuilderNode("builder-c", up), new BuilderNode("builder-a", down)));

        assertEquals(List.of("builder-c", "builder-a"), pool.builderIds());
        assertEquals(2, pool.size());
        assertEquals(Map.of("builder-c", true, "builder-a", false), pool.availability());
    }
}
