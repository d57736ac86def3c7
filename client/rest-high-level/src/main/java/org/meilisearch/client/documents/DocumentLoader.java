/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.documents;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.meilisearch.InvalidDocumentException;
import org.meilisearch.MeilisearchException;
import org.meilisearch.client.DefaultObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads documents from json, csv and ndjson files.
 * <p>
 * A json file must hold a single array of objects. A csv file must start with a header row naming the attributes, and
 * its values are kept as strings. An ndjson file holds one object per line, blank lines are skipped.
 */
public final class DocumentLoader {

    private static final CSVFormat CSV_FORMAT = CSVFormat.RFC4180.builder().setHeader().setSkipHeaderRecord(true).build();

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<LinkedHashMap<String, Object>>() {};

    private DocumentLoader() {}

    /**
     * Loads the documents held by a single file.
     *
     * @throws MeilisearchException if the file extension is not one of json, csv or ndjson
     * @throws InvalidDocumentException if the content is not a list of objects
     * @throws IOException if the file can not be read
     */
    public static List<Map<String, Object>> loadDocumentsFromFile(Path path) throws IOException {
        DocumentType type = DocumentType.fromPath(path);
        if (type == null) {
            throw new MeilisearchException("Documents must be in a json, csv, or ndjson file, found [" + path + "]");
        }
        switch (type) {
            case JSON:
                return loadJson(path);
            case CSV:
                return loadCsv(path);
            case NDJSON:
                return loadNdjson(path);
            default:
                throw new IllegalStateException("unexpected document type [" + type + "]");
        }
    }

    /**
     * Loads the documents of every file with the extension of {@code type} found directly under {@code directory},
     * one list per file. Files are read in name order.
     *
     * @throws MeilisearchException if no such file exists
     */
    public static List<List<Map<String, Object>>> loadDocumentsFromDirectory(Path directory, DocumentType type) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile).filter(file -> DocumentType.fromPath(file) == type).sorted().collect(Collectors.toList());
        }
        if (files.isEmpty()) {
            throw new MeilisearchException("No " + type.extension() + " files found in [" + directory + "]");
        }
        List<List<Map<String, Object>>> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            documents.add(loadDocumentsFromFile(file));
        }
        return documents;
    }

    /**
     * Flattens the per file document lists into a single list, keeping their order.
     */
    public static List<Map<String, Object>> combineDocuments(List<List<Map<String, Object>>> documents) {
        List<Map<String, Object>> combined = new ArrayList<>();
        for (List<Map<String, Object>> fileDocuments : documents) {
            combined.addAll(fileDocuments);
        }
        return combined;
    }

    private static List<Map<String, Object>> loadJson(Path path) throws IOException {
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = DefaultObjectMapper.objectMapper.readTree(in);
        }
        if (root == null || root.isArray() == false) {
            throw new InvalidDocumentException("Documents must be in a list of objects, found [" + path + "]");
        }
        List<Map<String, Object>> documents = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            documents.add(toDocument(node, path));
        }
        return documents;
    }

    private static List<Map<String, Object>> loadCsv(Path path) throws IOException {
        List<Map<String, Object>> documents = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            for (CSVRecord record : CSV_FORMAT.parse(reader)) {
                documents.add(new LinkedHashMap<>(record.toMap()));
            }
        }
        return documents;
    }

    private static List<Map<String, Object>> loadNdjson(Path path) throws IOException {
        List<Map<String, Object>> documents = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                documents.add(toDocument(DefaultObjectMapper.objectMapper.readTree(line), path));
            }
        }
        return documents;
    }

    private static Map<String, Object> toDocument(JsonNode node, Path path) {
        if (node instanceof ObjectNode == false) {
            throw new InvalidDocumentException("Documents must be in a list of objects, found [" + node + "] in [" + path + "]");
        }
        return DefaultObjectMapper.objectMapper.convertValue(node, DOCUMENT_TYPE);
    }
}
