package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class ModalityView implements Serializable {
    private static final long serialVersionUID = -1098236622370919334L;

    private String label;
    private String dominantLabel;
    private Double confidence;
    private Double stability;
    private int windowSamples;
}
