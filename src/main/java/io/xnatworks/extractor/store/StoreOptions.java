/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.store;

import io.xnatworks.extractor.config.ExtractorConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * What {@link PatientsDatabase#create} writes besides the arrays themselves.
 */
public class StoreOptions {

    private List<String> attributes = new ArrayList<>();
    private List<String> organsToKeep;
    private boolean geometryAttributes = true;
    private boolean transpose = true;

    public static StoreOptions fromConfig(ExtractorConfig config) {
        StoreOptions options = new StoreOptions();
        options.setAttributes(config.getAttributes());
        options.setOrgansToKeep(config.getOrgansToKeep());
        options.setGeometryAttributes(config.isGeometryAttributes());
        options.setTranspose(config.isTranspose());
        return options;
    }

    /**
     * DICOM keywords or tags copied onto each image dataset.
     */
    public List<String> getAttributes() { return attributes; }
    public void setAttributes(List<String> attributes) {
        this.attributes = attributes != null ? new ArrayList<>(attributes) : new ArrayList<>();
    }

    /**
     * Organs whose masks are written; null or empty keeps every organ.
     */
    public List<String> getOrgansToKeep() { return organsToKeep; }
    public void setOrgansToKeep(List<String> organsToKeep) {
        this.organsToKeep = organsToKeep != null ? new ArrayList<>(organsToKeep) : null;
    }

    public boolean isGeometryAttributes() { return geometryAttributes; }
    public void setGeometryAttributes(boolean geometryAttributes) { this.geometryAttributes = geometryAttributes; }

    /**
     * Store arrays as rows x columns x slices instead of slices x rows x columns.
     */
    public boolean isTranspose() { return transpose; }
    public void setTranspose(boolean transpose) { this.transpose = transpose; }

    boolean keepsOrgan(String organ) {
        return organsToKeep == null || organsToKeep.isEmpty() || organsToKeep.contains(organ);
    }
}
