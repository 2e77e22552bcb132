package com.deepknow.abis.interview.domain.assessment.model;

import com.deepknow.abis.interview.domain.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 面试官定义的评估指标。不可变，接入时校验 weight > 0。
 * keywords 为可选的精确匹配词表，命中时给出关键词加分。
 */
public final class Indicator {
    private final Long id;
    private final String name;
    private final String description;
    private final double weight;
    private final List<String> keywords;

    public Indicator(Long id, String name, String description, double weight, List<String> keywords) {
        if (id == null) {
            throw new ConfigurationException("Indicator id is required");
        }
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Indicator name is required: id=" + id);
        }
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new ConfigurationException("Indicator weight must be > 0: id=" + id + ", weight=" + weight);
        }
        this.id = id;
        this.name = name.trim();
        this.description = description == null ? "" : description.trim();
        this.weight = weight;
        List<String> kw = new ArrayList<>();
        if (keywords != null) {
            for (String k : keywords) {
                if (k != null && !k.isBlank()) kw.add(k.trim());
            }
        }
        this.keywords = Collections.unmodifiableList(kw);
    }

    public static Indicator of(long id, String name, String description, double weight) {
        return new Indicator(id, name, description, weight, null);
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public double getWeight() { return weight; }
    public List<String> getKeywords() { return keywords; }

    @Override
    public String toString() {
        return "Indicator{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", weight=" + weight +
                '}';
    }
}
