package com.spotifyimport.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifyimport.api.AuthServiceInterface;
import com.spotifyimport.api.BearerSession;
import com.spotifyimport.api.Diagnostics;
import com.spotifyimport.api.RetriesExhaustedException;
import com.spotifyimport.api.SpotifyApiClient;
import com.spotifyimport.api.SpotifyApiConfig;
import com.spotifyimport.api.SpotifyApiInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the command end to end against an in-memory Web API and a stubbed browser login.
 */
public class MainTest {
    private static final Diagnostics QUIET = new Diagnostics() {
        @Override
        public void info(String message, Object... args) {}

        @Override
        public void warn(String message, Object... args) {}

        @Override
        public void error(String message, Object... args) {}
    };

    @TempDir
    Path dir;

    private Path songs;
    private final StringWriter out = new StringWriter();
    private final List<String> sessionTokens = new ArrayList<>();
    private final StubAuth auth = new StubAuth();
    private final FakeSpotifyApi api = new FakeSpotifyApi()
        .track("The Beatles Hey Jude", "Hey Jude", "The Beatles", "spotify:track:1");

    @BeforeEach
    void writeSongs() throws IOException {
        songs = dir.resolve("songs.json");
        Files.writeString(songs, "[{\"title\":\"Hey Jude (Remastered)\",\"artist\":\"The Beatles\"},"
            + "{\"title\":\"Unknown Song\",\"artist\":\"Nobody\"}]");
    }

    private int run(SpotifyApiInterface spotify, String... args) {
        Main main = new Main(QUIET, d -> auth, session -> {
            sessionTokens.add(session.token());
            return spotify;
        });
        CommandLine cmd = new CommandLine(main);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    @Test
    void testDryRunPrintsReportAndImportsNothing() {
        int exit = run(api, "--token", "TOKEN", "p1", songs.toString());

        assertEquals(0, exit);
        assertEquals("Hey Jude,The Beatles,Hey Jude,The Beatles,0\nUnknown Song,Nobody,,\n", out.toString());
        assertTrue(api.postPaths.isEmpty());
        assertEquals(List.of("TOKEN"), sessionTokens);
        assertEquals(0, auth.calls);
    }

    @Test
    void testImportAddsMatchedTracks() {
        int exit = run(api, "--token", "TOKEN", "--import", "p1", songs.toString());

        assertEquals(0, exit);
        assertEquals(List.of("playlists/p1/tracks"), api.postPaths);
        assertEquals("[\"spotify:track:1\"]", api.postBodies.get(0).path("uris").toString());
    }

    @Test
    void testPlaylistIdIsEncodedInPath() {
        int exit = run(api, "--token", "TOKEN", "--import", "my list", songs.toString());

        assertEquals(0, exit);
        assertEquals(List.of("playlists/my%20list/tracks"), api.postPaths);
    }

    @Test
    void testMalformedRequestUrlIsFatalNotACrash() {
        SpotifyApiConfig config = SpotifyApiConfig.defaults().withBaseUrl("http://127.0.0.1:1/bad path/");
        Main main = new Main(QUIET, d -> auth, session -> new SpotifyApiClient(config, session, QUIET));
        CommandLine cmd = new CommandLine(main);
        cmd.setOut(new PrintWriter(out));
        StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err));

        assertEquals(1, cmd.execute("--token", "TOKEN", "--import", "p1", songs.toString()));
        assertEquals("", err.toString());
    }

    @Test
    void testBrowserLoginWhenNoTokenGiven() {
        int exit = run(api, "p1", songs.toString());

        assertEquals(0, exit);
        assertEquals(1, auth.calls);
        assertEquals(Main.SCOPES, auth.scopes);
        assertEquals(List.of("BROWSER"), sessionTokens);
    }

    @Test
    void testInvalidFileFails() throws IOException {
        Files.writeString(songs, "{not json");

        assertEquals(1, run(api, "--token", "TOKEN", "p1", songs.toString()));
        assertTrue(sessionTokens.isEmpty());
        assertEquals("", out.toString());
    }

    @Test
    void testMissingFileFails() {
        assertEquals(1, run(api, "--token", "TOKEN", "p1", dir.resolve("missing.json").toString()));
    }

    @Test
    void testBlankTokenFails() {
        assertEquals(1, run(api, "--token", " ", "p1", songs.toString()));
        assertTrue(sessionTokens.isEmpty());
    }

    @Test
    void testExhaustedRetriesFail() {
        SpotifyApiInterface down = new SpotifyApiInterface() {
            @Override
            public JsonNode get(String path, Map<String, String> params) {
                throw new RetriesExhaustedException("https://api.spotify.com/v1/" + path, 3,
                    new IOException("connection refused"));
            }

            @Override
            public JsonNode post(String path, Map<String, String> params, JsonNode body) {
                throw new AssertionError("no post expected");
            }

            @Override
            public List<JsonNode> list(String path, Map<String, String> params) {
                throw new AssertionError("no list expected");
            }
        };

        assertEquals(1, run(down, "--token", "TOKEN", "--import", "p1", songs.toString()));
    }

    @Test
    void testMissingArgumentsIsUsageError() {
        assertEquals(2, run(api, "--token", "TOKEN"));
    }

    private static final class StubAuth implements AuthServiceInterface {
        int calls;
        List<String> scopes;

        @Override
        public String buildAuthorizeUrl(String clientId, List<String> scopes) {
            return "https://accounts.spotify.com/authorize?client_id=" + clientId;
        }

        @Override
        public BearerSession authorize(String clientId, List<String> scopes) {
            calls++;
            this.scopes = scopes;
            return new BearerSession("BROWSER");
        }
    }
}
