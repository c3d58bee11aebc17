package com.spotifyimport.importer;

import java.io.IOException;

/**
 * The import file could not be read or is not a JSON array of songs.
 */
public class InvalidImportFileException extends IOException {

    public InvalidImportFileException(String message) {
        super(message);
    }

    public InvalidImportFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
