package com.yerin.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "users")
public class User {

    public static final String DELETE_AFTER = "delete-after";

    @Id
    @Column(length = 200)
    private String name;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "userdata", nullable = false, columnDefinition = "text")
    private Map<String, Object> userdata = new LinkedHashMap<>();

    @Column(name = "delete_after", length = 100)
    private String deleteAfter;

    public User(String name, Map<String, Object> userdata) {
        this.name = name;
        this.userdata = new LinkedHashMap<>(userdata == null ? Map.of() : userdata);
        sync();
    }

    public Object getValue(String key) {
        return userdata.get(key);
    }

    public void setValue(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(userdata);
        if (value == null) copy.remove(key); else copy.put(key, value);
        this.userdata = copy;
        sync();
    }

    private void sync() {
        Object v = userdata.get(DELETE_AFTER);
        this.deleteAfter = v == null ? null : v.toString();
    }
}
