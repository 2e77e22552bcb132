package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class IndicatorDto implements Serializable {
    private static final long serialVersionUID = 6621879532016693845L;

    private Long id;
    private String name;
    private String description;
    private double weight;
    private List<String> keywords;
}
