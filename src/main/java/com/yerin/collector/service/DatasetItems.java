package com.yerin.collector.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 데이터셋 결과 파일(NDJSON)의 아이템을 한 줄씩 읽는 시퀀스.
 * stream() 을 부를 때마다 파일을 새로 열기 때문에 여러 번 순회해도 상위 작업을 다시 돌리지 않는다.
 * 반환된 Stream 은 try-with-resources 로 닫아야 한다.
 */
public class DatasetItems {

    private static final ObjectMapper om = new ObjectMapper();

    private final Path path;
    private final ObjectReader reader = om.readerFor(Map.class);

    public DatasetItems(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public Stream<Map<String, Object>> stream() {
        if (path == null || !Files.exists(path)) return Stream.empty();
        try {
            BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
            MappingIterator<Map<String, Object>> it = reader.readValues(in);
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED), false)
                    .onClose(() -> closeIterator(it));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read items from " + path, e);
        }
    }

    public long count() {
        try (Stream<Map<String, Object>> items = stream()) {
            return items.count();
        }
    }

    private static void closeIterator(MappingIterator<?> it) {
        try {
            it.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
