package com.spotifyimport.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifyimport.api.AuthServiceInterface;
import com.spotifyimport.api.BearerSession;
import com.spotifyimport.api.Diagnostics;
import com.spotifyimport.api.SpotifyApiClient;
import com.spotifyimport.api.SpotifyApiConfig;
import com.spotifyimport.api.SpotifyApiException;
import com.spotifyimport.api.SpotifyApiInterface;
import com.spotifyimport.api.SpotifyAuthService;
import com.spotifyimport.api.Slf4jDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Main entry point for the Spotify playlist importer.
 * <p>
 * Reads a JSON list of songs, searches Spotify for each one and prints a CSV report to standard
 * output. With {@code --import} the matched tracks are also added to the given playlist. By default
 * a browser window is opened to authorize the Web API; {@code --token} skips that.
 * <p>
 * Exit codes: 0 on success, 1 for an invalid input file or a failure talking to Spotify,
 * 2 for usage errors.
 *
 * @author Spotify Import Team
 * @since 1.0
 */
@Command(
    name = "spotify-import",
    mixinStandardHelpOptions = true,
    version = "spotify-import 1.0",
    description = "Imports a JSON song list into a Spotify playlist. By default opens a browser window "
        + "to authorize the Spotify Web API; use --token to supply an OAuth token instead."
)
public class Main implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_CLIENT_ID = "f273705a8fa44a1f9b962c355c5ee6e5";
    static final List<String> SCOPES = List.of(
        "playlist-read-private",
        "playlist-read-collaborative",
        "user-library-read",
        "playlist-modify-public",
        "playlist-modify-private"
    );

    @Option(
        names = {"--token"},
        paramLabel = "OAUTH_TOKEN",
        description = "Use a Spotify OAuth token (requires the playlist-modify permissions)"
    )
    String token;

    @Option(
        names = {"--import"},
        description = "Add the matched tracks to the playlist instead of only printing the CSV report"
    )
    boolean importTracks;

    @Parameters(index = "0", paramLabel = "PLAYLIST", description = "Playlist ID")
    String playlistId;

    @Parameters(index = "1", paramLabel = "FILE", description = "Input JSON file")
    Path file;

    @Spec
    CommandSpec spec;

    private final Diagnostics diagnostics;
    private final Function<Diagnostics, AuthServiceInterface> authFactory;
    private final Function<BearerSession, SpotifyApiInterface> apiFactory;

    public Main() {
        this(SpotifyApiConfig.fromEnvironment(), Slf4jDiagnostics.named("spotify-import"));
    }

    private Main(SpotifyApiConfig config, Diagnostics diagnostics) {
        this(diagnostics,
            d -> new SpotifyAuthService(config, d),
            session -> new SpotifyApiClient(config, session, diagnostics));
    }

    Main(Diagnostics diagnostics,
         Function<Diagnostics, AuthServiceInterface> authFactory,
         Function<BearerSession, SpotifyApiInterface> apiFactory) {
        this.diagnostics = diagnostics;
        this.authFactory = authFactory;
        this.apiFactory = apiFactory;
    }

    @Override
    public Integer call() {
        List<Song> songs;
        try {
            songs = new SongFileReader().read(file);
        } catch (InvalidImportFileException e) {
            logger.error("Invalid JSON file provided. {}", e.getMessage());
            return 1;
        }

        if (token != null && token.isBlank()) {
            logger.error("--token must not be empty");
            return 1;
        }

        try {
            BearerSession session = token != null
                ? new BearerSession(token)
                : authFactory.apply(diagnostics).authorize(clientId(), SCOPES);
            SpotifyApiInterface api = apiFactory.apply(session);

            logger.info("Loading user info...");
            JsonNode me = api.get("me");
            logger.info("Logged in as {} ({})", me.path("display_name").asText(), me.path("id").asText());

            List<String> uris = searchAndReport(api, songs, spec.commandLine().getOut());

            if (importTracks) {
                new PlaylistImportService(api).importTracks(playlistId, uris);
            } else {
                logger.info("Dry run: {} of {} songs matched, nothing imported", uris.size(), songs.size());
            }
            return 0;
        } catch (SpotifyApiException e) {
            logger.error("Fatal: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Failed to write CSV report: {}", e.getMessage());
            return 1;
        }
    }

    private List<String> searchAndReport(SpotifyApiInterface api, List<Song> songs, PrintWriter out)
        throws IOException {
        TrackSearchService search = new TrackSearchService(api);
        CsvServiceInterface csv = new CsvService(out);
        List<String> uris = new ArrayList<>();
        for (Song song : songs) {
            TrackMatch match = search.search(song);
            csv.writeMatch(match);
            if (match.matched()) {
                uris.add(match.uri());
            }
        }
        return uris;
    }

    private static String clientId() {
        return SpotifyApiConfig.setting("SPOTIFY_CLIENT_ID", DEFAULT_CLIENT_ID);
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
