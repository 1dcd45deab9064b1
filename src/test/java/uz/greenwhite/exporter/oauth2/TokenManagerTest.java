package uz.greenwhite.exporter.oauth2;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uz.greenwhite.exporter.MutableClock;
import uz.greenwhite.exporter.config.HttpClientConfig;
import uz.greenwhite.exporter.config.HttpProperties;
import uz.greenwhite.exporter.config.RetryProperties;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.notification.NotificationService;
import uz.greenwhite.exporter.oauth2.client.MercedesOAuth2Client;
import uz.greenwhite.exporter.oauth2.client.OAuth2Client;
import uz.greenwhite.exporter.oauth2.exception.AuthorizationRejectedException;
import uz.greenwhite.exporter.oauth2.exception.CredentialStoreException;
import uz.greenwhite.exporter.oauth2.exception.OAuth2ErrorType;
import uz.greenwhite.exporter.oauth2.exception.ReauthorizationRequiredException;
import uz.greenwhite.exporter.oauth2.exception.TokenEndpointException;
import uz.greenwhite.exporter.oauth2.exception.TransientTokenException;
import uz.greenwhite.exporter.oauth2.model.Credential;
import uz.greenwhite.exporter.oauth2.model.TokenResponse;
import uz.greenwhite.exporter.oauth2.store.CredentialStore;
import uz.greenwhite.exporter.oauth2.store.FileCredentialStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TokenManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private OAuth2Client client;
    private NotificationService notificationService;
    private OAuth2Properties properties;
    private ExporterMetrics metrics;
    private FileCredentialStore store;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        client = mock(OAuth2Client.class);
        notificationService = mock(NotificationService.class);
        properties = OAuth2TestProperties.create("https://id.example.com/as/token.oauth2");
        metrics = new ExporterMetrics(new SimpleMeterRegistry());
        store = new FileCredentialStore(tempDir.resolve("state.json"), new ObjectMapper(), metrics);
        clock = new MutableClock(NOW);
    }

    private TokenManager newManager() {
        return new TokenManager(client, store, properties, metrics, notificationService, clock);
    }

    private void persist(String accessToken, String refreshToken, Instant expiresAt) {
        store.save(new Credential(accessToken, refreshToken, expiresAt, Set.of("offline_access"), "Bearer"));
    }

    // ==================== STARTUP ====================

    @Test
    void startsUnauthenticatedWithoutPersistedCredential() {
        TokenManager manager = newManager();

        assertEquals(TokenState.UNAUTHENTICATED, manager.getState());
        assertThrows(ReauthorizationRequiredException.class, manager::getValidToken);
        verifyNoInteractions(client);
    }

    @Test
    void validPersistedTokenIsServedWithoutNetworkCall() {
        persist("access-1", "refresh-1", NOW.plusSeconds(600));
        TokenManager manager = newManager();

        assertEquals(TokenState.AUTHENTICATED_VALID, manager.getState());
        assertEquals("access-1", manager.getValidToken());
        assertEquals("access-1", manager.getValidToken());
        verifyNoInteractions(client);
    }

    @Test
    void expiredPersistedTokenIsRefreshedOnFirstUse() {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenReturn(new TokenResponse("access-2", "refresh-2", 3600L, null, "Bearer"));
        TokenManager manager = newManager();
        assertEquals(TokenState.AUTHENTICATED_EXPIRED, manager.getState());

        assertEquals("access-2", manager.getValidToken());

        Credential saved = store.load().orElseThrow();
        assertEquals("access-2", saved.accessToken());
        assertEquals("refresh-2", saved.refreshToken());
        assertEquals(NOW.plusSeconds(3600 - 30), saved.expiresAt());
        assertEquals(Set.of("offline_access"), saved.scope());
        assertEquals(TokenState.AUTHENTICATED_VALID, manager.getState());
        assertEquals(1.0, metrics.getTokenRefreshSuccess().count());
    }

    @Test
    void tokenExpiresOnceMarginIsReached() {
        persist("access-1", "refresh-1", NOW.plusSeconds(60));
        when(client.refreshAccessToken(any(), anyString()))
                .thenReturn(new TokenResponse("access-2", null, 3600L, null, null));
        TokenManager manager = newManager();

        clock.advance(Duration.ofSeconds(59));
        assertEquals("access-1", manager.getValidToken());

        clock.advance(Duration.ofSeconds(1));
        assertEquals("access-2", manager.getValidToken());
        verify(client, times(1)).refreshAccessToken(any(), eq("refresh-1"));
    }

    // ==================== REFRESH ====================

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.refreshAccessToken(any(), eq("refresh-1"))).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return new TokenResponse("access-2", "refresh-2", 3600L, null, "Bearer");
        });
        TokenManager manager = newManager();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(manager::getValidToken));
            }
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);
            assertEquals(TokenState.REFRESHING, manager.getState());
            release.countDown();

            for (Future<String> result : results) {
                assertEquals("access-2", result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        verify(client, times(1)).refreshAccessToken(any(), anyString());
        assertEquals("refresh-2", store.load().orElseThrow().refreshToken());
    }

    @Test
    void refreshWithoutNewRefreshTokenKeepsPreviousOne() {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenReturn(new TokenResponse("access-2", null, 3600L, null, "Bearer"));
        TokenManager manager = newManager();

        manager.getValidToken();

        assertEquals("refresh-1", store.load().orElseThrow().refreshToken());
    }

    @Test
    void transientFailureKeepsCredentialAndFile() throws Exception {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        byte[] before = Files.readAllBytes(store.getStateFile());
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenThrow(new TokenEndpointException(OAuth2ErrorType.TRANSIENT_NETWORK, 0, null,
                        "token endpoint did not answer within PT30S", null));
        TokenManager manager = newManager();

        assertThrows(TransientTokenException.class, manager::getValidToken);

        assertEquals(TokenState.AUTHENTICATED_EXPIRED, manager.getState());
        assertArrayEquals(before, Files.readAllBytes(store.getStateFile()));
        assertEquals(1.0, metrics.getTokenRefreshTransient().count());
        verifyNoInteractions(notificationService);
    }

    @Test
    void transientFailureIsRetriedOnNextCall() {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenThrow(new TokenEndpointException(OAuth2ErrorType.TRANSIENT_NETWORK, 503,
                        "temporarily_unavailable", null, null))
                .thenReturn(new TokenResponse("access-2", "refresh-2", 3600L, null, "Bearer"));
        TokenManager manager = newManager();

        assertThrows(TransientTokenException.class, manager::getValidToken);
        assertEquals("access-2", manager.getValidToken());
    }

    @Test
    void rejectedRefreshClearsCredentialAndSurvivesRestart() {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenThrow(new TokenEndpointException(OAuth2ErrorType.TERMINAL_GRANT, 400,
                        "invalid_grant", "refresh token revoked", null));
        TokenManager manager = newManager();

        assertThrows(ReauthorizationRequiredException.class, manager::getValidToken);

        assertEquals(TokenState.UNAUTHENTICATED, manager.getState());
        assertFalse(Files.exists(store.getStateFile()));
        assertEquals(1.0, metrics.getTokenRefreshTerminal().count());
        verify(notificationService).sendReauthorizationAlert(contains("invalid_grant"));

        assertEquals(TokenState.UNAUTHENTICATED, newManager().getState());
    }

    @Test
    void misconfiguredTokenEndpointKeepsRefreshToken() throws Exception {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        RetryProperties retryProperties = new RetryProperties();
        retryProperties.init();
        OAuth2Client realClient = new MercedesOAuth2Client(
                HttpClientConfig.buildWebClient(new HttpProperties()), new ObjectMapper(), retryProperties);

        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(404).setBody("<html>Not Found</html>"));
            server.start();
            properties.setTokenUrl(server.url("/wrong/token").toString());
            TokenManager manager = new TokenManager(realClient, store, properties, metrics, notificationService, clock);

            assertThrows(TransientTokenException.class, manager::getValidToken);

            assertEquals(TokenState.AUTHENTICATED_EXPIRED, manager.getState());
            assertEquals("refresh-1", store.load().orElseThrow().refreshToken());
            verifyNoInteractions(notificationService);
        }
    }

    @Test
    void credentialWithoutRefreshTokenRequiresReauthorization() {
        persist("access-1", null, NOW.minusSeconds(1));
        TokenManager manager = newManager();

        assertThrows(ReauthorizationRequiredException.class, manager::getValidToken);
        verifyNoInteractions(client);
    }

    @Test
    void forceRefreshReplacesRejectedToken() {
        persist("access-1", "refresh-1", NOW.plusSeconds(600));
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenReturn(new TokenResponse("access-2", "refresh-2", 3600L, null, "Bearer"));
        TokenManager manager = newManager();

        assertEquals("access-2", manager.forceRefresh("access-1"));
        // A second caller holding the old token gets the new one without another exchange
        assertEquals("access-2", manager.forceRefresh("access-1"));
        verify(client, times(1)).refreshAccessToken(any(), anyString());
    }

    @Test
    void waitersLearnAboutRevokedGrantBeforeAlertIsSent() throws Exception {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch waiterDone = new CountDownLatch(1);
        AtomicBoolean waiterDoneBeforeAlert = new AtomicBoolean();
        when(client.refreshAccessToken(any(), eq("refresh-1"))).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            throw new TokenEndpointException(OAuth2ErrorType.TERMINAL_GRANT, 400, "invalid_grant", null, null);
        });
        doAnswer(invocation -> {
            waiterDoneBeforeAlert.set(waiterDone.await(5, TimeUnit.SECONDS));
            return null;
        }).when(notificationService).sendReauthorizationAlert(anyString());
        TokenManager manager = newManager();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> leader = executor.submit(manager::getValidToken);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<?> waiter = executor.submit(() -> {
                try {
                    manager.getValidToken();
                } catch (ReauthorizationRequiredException e) {
                    waiterDone.countDown();
                }
            });
            Thread.sleep(200);
            release.countDown();

            waiter.get(10, TimeUnit.SECONDS);
            ExecutionException e = assertThrows(ExecutionException.class, () -> leader.get(10, TimeUnit.SECONDS));
            assertInstanceOf(ReauthorizationRequiredException.class, e.getCause());
        } finally {
            executor.shutdownNow();
        }

        assertTrue(waiterDoneBeforeAlert.get());
    }

    @Test
    void refreshSurvivesStoreFailure() {
        CredentialStore failingStore = mock(CredentialStore.class);
        when(failingStore.load()).thenReturn(Optional.of(
                new Credential("access-1", "refresh-1", NOW.minusSeconds(1), Set.of(), "Bearer")));
        doThrow(new CredentialStoreException("disk full", null)).when(failingStore).save(any());
        when(client.refreshAccessToken(any(), eq("refresh-1")))
                .thenReturn(new TokenResponse("access-2", "refresh-2", 3600L, null, "Bearer"));
        TokenManager manager = new TokenManager(client, failingStore, properties, metrics, notificationService, clock);

        assertEquals("access-2", manager.getValidToken());
        assertEquals(TokenState.AUTHENTICATED_VALID, manager.getState());
    }

    // ==================== AUTHORIZATION ====================

    @Test
    void completeAuthorizationStoresCredential() {
        when(client.exchangeAuthorizationCode(any(), eq("code-1")))
                .thenReturn(new TokenResponse("access-1", "refresh-1", 3600L,
                        "offline_access mb:vehicle:mbdata:evstatus", "Bearer"));
        TokenManager manager = newManager();

        Credential credential = manager.completeAuthorization("code-1");

        assertEquals(TokenState.AUTHENTICATED_VALID, manager.getState());
        assertEquals("access-1", manager.getValidToken());
        assertEquals(credential, store.load().orElseThrow());
        assertEquals(NOW.plusSeconds(3570), credential.expiresAt());
        assertEquals(1.0, metrics.getAuthorizationSuccess().count());
    }

    @Test
    void completeAuthorizationFailsWhenCredentialCannotBeWritten() {
        CredentialStore failingStore = mock(CredentialStore.class);
        when(failingStore.load()).thenReturn(Optional.empty());
        doThrow(new CredentialStoreException("read-only file system", null)).when(failingStore).save(any());
        when(client.exchangeAuthorizationCode(any(), eq("code-1")))
                .thenReturn(new TokenResponse("access-1", "refresh-1", 3600L, null, "Bearer"));
        TokenManager manager = new TokenManager(client, failingStore, properties, metrics, notificationService, clock);

        assertThrows(CredentialStoreException.class, () -> manager.completeAuthorization("code-1"));

        assertEquals(TokenState.AUTHENTICATED_VALID, manager.getState());
        assertEquals(0.0, metrics.getAuthorizationSuccess().count());
        verify(failingStore).save(any());
    }

    @Test
    void rejectedCodeLeavesStateUntouched() {
        when(client.exchangeAuthorizationCode(any(), eq("used-code")))
                .thenThrow(new TokenEndpointException(OAuth2ErrorType.TERMINAL_GRANT, 400,
                        "invalid_grant", "code already used", null));
        TokenManager manager = newManager();

        assertThrows(AuthorizationRejectedException.class, () -> manager.completeAuthorization("used-code"));

        assertEquals(TokenState.UNAUTHENTICATED, manager.getState());
        assertFalse(Files.exists(store.getStateFile()));
        assertEquals(1.0, metrics.getAuthorizationRejected().count());
    }

    @Test
    void unreachableTokenEndpointDuringCodeExchangeIsTransient() {
        when(client.exchangeAuthorizationCode(any(), anyString()))
                .thenThrow(new TokenEndpointException(OAuth2ErrorType.TRANSIENT_NETWORK, 0, null, "timeout", null));
        TokenManager manager = newManager();

        assertThrows(TransientTokenException.class, () -> manager.completeAuthorization("code-1"));
        assertEquals(0.0, metrics.getAuthorizationRejected().count());
    }

    @Test
    void missingScopeIsRejectedWhenAllScopesRequired() {
        properties.setRequireAllScopes(true);
        when(client.exchangeAuthorizationCode(any(), anyString()))
                .thenReturn(new TokenResponse("access-1", "refresh-1", 3600L, "offline_access", "Bearer"));
        TokenManager manager = newManager();

        assertThrows(AuthorizationRejectedException.class, () -> manager.completeAuthorization("code-1"));
        assertEquals(TokenState.UNAUTHENTICATED, manager.getState());
    }

    @Test
    void missingScopeIsAcceptedByDefault() {
        when(client.exchangeAuthorizationCode(any(), anyString()))
                .thenReturn(new TokenResponse("access-1", "refresh-1", 3600L, "offline_access", "Bearer"));
        TokenManager manager = newManager();

        Credential credential = manager.completeAuthorization("code-1");

        assertEquals(Set.of("offline_access"), credential.scope());
    }

    @Test
    void reauthorizationRecoversFromUnauthenticated() {
        persist("access-1", "refresh-1", NOW.minusSeconds(1));
        when(client.refreshAccessToken(any(), anyString()))
                .thenThrow(new TokenEndpointException(OAuth2ErrorType.TERMINAL_GRANT, 400,
                        "invalid_grant", null, null));
        when(client.exchangeAuthorizationCode(any(), eq("code-2")))
                .thenReturn(new TokenResponse("access-3", "refresh-3", 3600L, null, "Bearer"));
        TokenManager manager = newManager();
        assertThrows(ReauthorizationRequiredException.class, manager::getValidToken);

        manager.completeAuthorization("code-2");

        assertEquals("access-3", manager.getValidToken());
        assertEquals("refresh-3", store.load().orElseThrow().refreshToken());
    }

    @Test
    void statusNeverExposesTokens() {
        persist("access-1", "refresh-1", NOW.plusSeconds(600));
        TokenManager manager = newManager();

        var status = manager.getStatus(false);

        assertEquals(TokenState.AUTHENTICATED_VALID, status.state());
        assertTrue(status.refreshTokenPresent());
        assertFalse(status.toString().contains("access-1"));
        assertFalse(status.toString().contains("refresh-1"));
    }
}
