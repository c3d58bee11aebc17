package com.spotifyimport.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the JSON song list that is going to be imported.
 * <p>
 * Runs before anything touches the network, so a broken file fails the run early.
 */
public class SongFileReader {
    private static final Logger logger = LoggerFactory.getLogger(SongFileReader.class);
    private static final TypeReference<List<Song>> SONG_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public SongFileReader() {
        this(new ObjectMapper());
    }

    public SongFileReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param file JSON array of {@code {"title": ..., "artist": ...}} objects
     * @return songs in file order
     * @throws InvalidImportFileException if the file is missing, is not valid JSON or has entries
     *                                    without a title or artist
     */
    public List<Song> read(Path file) throws InvalidImportFileException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new InvalidImportFileException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    List<Song> parse(String content) throws InvalidImportFileException {
        List<Song> songs;
        try {
            songs = mapper.readValue(content, SONG_LIST);
        } catch (JsonProcessingException e) {
            throw new InvalidImportFileException("Not a JSON array of songs: " + e.getOriginalMessage(), e);
        }
        if (songs == null) {
            throw new InvalidImportFileException("Not a JSON array of songs: null");
        }
        for (int i = 0; i < songs.size(); i++) {
            Song song = songs.get(i);
            if (song == null || isBlank(song.title()) || isBlank(song.artist())) {
                throw new InvalidImportFileException("Entry " + i + " needs a title and an artist");
            }
        }
        logger.info("Read {} songs to import", songs.size());
        return songs;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
