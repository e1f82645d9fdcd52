package com.hydromat.tooling.service;

import com.hydromat.tooling.exception.SetPhotoOwnershipException;
import com.hydromat.tooling.model.Tool;
import lombok.Getter;

/**
 * Outcome of {@link ToolService#updateTool}. Field changes are always applied; a photo change
 * submitted for a tool that does not own its set photo is reported here instead of being applied.
 */
@Getter
public class ToolUpdateResult {

    private final Tool tool;
    private final SetPhotoOwnershipException photoRejection;

    public ToolUpdateResult(Tool tool, SetPhotoOwnershipException photoRejection) {
        this.tool = tool;
        this.photoRejection = photoRejection;
    }

    public boolean isPhotoRejected() {
        return photoRejection != null;
    }
}
