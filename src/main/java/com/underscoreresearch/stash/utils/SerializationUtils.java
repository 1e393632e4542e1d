package com.underscoreresearch.stash.utils;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.underscoreresearch.stash.model.StashConfiguration;

public class SerializationUtils {
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final ObjectReader STASH_CONFIGURATION_READER = MAPPER
            .readerFor(StashConfiguration.class);
    public static final ObjectWriter STASH_CONFIGURATION_WRITER = MAPPER
            .writerFor(StashConfiguration.class)
            .withDefaultPrettyPrinter();

    public static StashConfiguration readConfiguration(File file) throws IOException {
        return STASH_CONFIGURATION_READER.readValue(file);
    }
}
