package me.golemcore.steward.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.steward.domain.service.ActiveSessionStore;
import me.golemcore.steward.domain.service.AnchorEventWriter;
import me.golemcore.steward.domain.service.AuditInbox;
import me.golemcore.steward.domain.service.CompactionGate;
import me.golemcore.steward.domain.service.ConflictDetector;
import me.golemcore.steward.domain.service.ContextMergeEngine;
import me.golemcore.steward.domain.service.PersistenceModeSelector;
import me.golemcore.steward.domain.service.ProjectLayoutService;
import me.golemcore.steward.domain.service.SessionManager;
import me.golemcore.steward.domain.service.SessionReaper;
import me.golemcore.steward.domain.service.SessionRegistry;
import me.golemcore.steward.domain.service.SynthesisInvoker;
import me.golemcore.steward.domain.transcript.ExplicitPathLocator;
import me.golemcore.steward.domain.transcript.LegacyPathLocator;
import me.golemcore.steward.domain.transcript.ProjectConfigLocator;
import me.golemcore.steward.domain.transcript.TemporalBeaconLocator;
import me.golemcore.steward.domain.transcript.TranscriptFormatter;
import me.golemcore.steward.domain.transcript.TranscriptParser;
import me.golemcore.steward.domain.transcript.TranscriptResolver;
import me.golemcore.steward.infrastructure.config.AutoConfiguration;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import me.golemcore.steward.port.outbound.SynthesisPort;
import me.golemcore.steward.security.PathGuard;
import me.golemcore.steward.security.SecretRedactor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the real domain services over a temporary directory, with a mocked
 * synthesis delegate and a controllable clock.
 */
public class StewardFixture {

    public static final Instant START = Instant.parse("2026-01-01T12:00:00Z");

    public final Path projectRoot;
    public final Path transcriptsRoot;
    public final StewardProperties properties = new StewardProperties();
    public final MutableClock clock = new MutableClock(START);
    public final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    public final RecordingStoragePort storage = new RecordingStoragePort(new LocalStorageAdapter());
    public final SynthesisPort synthesisPort = mock(SynthesisPort.class);

    public final PathGuard pathGuard = new PathGuard();
    public final SecretRedactor secretRedactor = new SecretRedactor();
    public final ProjectLayoutService layoutService;
    public final PersistenceModeSelector modeSelector;
    public final ActiveSessionStore sessionStore;
    public final SessionRegistry sessionRegistry;
    public final SessionReaper sessionReaper;
    public final AuditInbox auditInbox;
    public final AnchorEventWriter anchorEventWriter;
    public final ConflictDetector conflictDetector = new ConflictDetector();
    public final CompactionGate compactionGate;
    public final SynthesisInvoker synthesisInvoker;
    public final ContextMergeEngine mergeEngine;
    public final TranscriptParser transcriptParser;
    public final TranscriptFormatter transcriptFormatter;
    public final TranscriptResolver transcriptResolver;
    public final SessionManager sessionManager;

    public StewardFixture(Path tempDir) {
        this.projectRoot = createDirectory(tempDir.resolve("project"));
        this.transcriptsRoot = createDirectory(tempDir.resolve("transcripts"));
        properties.getTranscripts().setRoot(transcriptsRoot.toString());
        properties.getContext().setLockTimeout(Duration.ofSeconds(2));
        when(synthesisPort.isAvailable()).thenReturn(false);

        layoutService = new ProjectLayoutService(storage, pathGuard, properties);
        modeSelector = new PersistenceModeSelector(storage);
        sessionStore = new ActiveSessionStore(storage, objectMapper);
        sessionRegistry = new SessionRegistry(storage, sessionStore, objectMapper, properties, clock);
        sessionReaper = new SessionReaper(storage, sessionStore, sessionRegistry, properties, clock);
        auditInbox = new AuditInbox(storage, objectMapper, properties, clock);
        anchorEventWriter = new AnchorEventWriter(storage, modeSelector, objectMapper, clock);
        compactionGate = new CompactionGate(storage, properties, clock);
        synthesisInvoker = new SynthesisInvoker(synthesisPort, properties, clock);
        mergeEngine = new ContextMergeEngine(storage, layoutService, modeSelector, auditInbox, anchorEventWriter,
                conflictDetector, compactionGate, synthesisInvoker, pathGuard, properties, clock);
        transcriptParser = new TranscriptParser(objectMapper, secretRedactor, properties);
        transcriptFormatter = new TranscriptFormatter(objectMapper);
        transcriptResolver = new TranscriptResolver(List.of(
                new ExplicitPathLocator(properties),
                new TemporalBeaconLocator(properties),
                new ProjectConfigLocator(properties, objectMapper),
                new LegacyPathLocator(properties)), pathGuard);
        sessionManager = new SessionManager(storage, layoutService, modeSelector, sessionStore, sessionRegistry,
                sessionReaper, transcriptResolver, transcriptParser, transcriptFormatter, synthesisInvoker,
                mergeEngine, pathGuard, properties, clock);
    }

    public String workingDir() {
        return projectRoot.toString();
    }

    public Path stateRoot() {
        return projectRoot.resolve(".steward");
    }

    public Path contextFile(String target) {
        return stateRoot().resolve("context").resolve(target + ".md");
    }

    public Path historyFile() {
        return stateRoot().resolve("context").resolve("PROJECT-HISTORY.md");
    }

    public String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            return Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Path createDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
