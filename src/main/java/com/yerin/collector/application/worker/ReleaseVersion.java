package com.yerin.collector.application.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 점으로 구분된 숫자 버전 + 선택적 접미사(rc1, -beta 등). 접미사가 있으면 같은 숫자의 정식 버전보다 낮다.
 */
public record ReleaseVersion(List<Integer> numbers, String qualifier) implements Comparable<ReleaseVersion> {

    private static final Pattern VERSION = Pattern.compile("^(\\d+(?:\\.\\d+)*)[-.]?(.*)$");

    public static ReleaseVersion parse(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.startsWith("v") || v.startsWith("V")) v = v.substring(1);
        Matcher m = VERSION.matcher(v);
        if (!m.matches()) throw new IllegalArgumentException("not a version: " + raw);
        List<Integer> numbers = new ArrayList<>();
        for (String part : m.group(1).split("\\.")) {
            numbers.add(Integer.parseInt(part));
        }
        return new ReleaseVersion(List.copyOf(numbers), m.group(2));
    }

    @Override
    public int compareTo(ReleaseVersion other) {
        int len = Math.max(numbers.size(), other.numbers.size());
        for (int i = 0; i < len; i++) {
            int a = i < numbers.size() ? numbers.get(i) : 0;
            int b = i < other.numbers.size() ? other.numbers.get(i) : 0;
            if (a != b) return Integer.compare(a, b);
        }
        if (qualifier.isEmpty() || other.qualifier.isEmpty()) {
            return Boolean.compare(qualifier.isEmpty(), other.qualifier.isEmpty());
        }
        return qualifier.compareTo(other.qualifier);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < numbers.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(numbers.get(i));
        }
        return sb.append(qualifier).toString();
    }
}
