package com.examify.core.event;

import lombok.Value;

import java.util.UUID;

/**
 * Published once per accepted upload, after the material row is committed.
 *
 * <ul>
 *   <li>{@code materialId}: the new StudyMaterial, also the ledger's source entity id</li>
 *   <li>{@code userId}: the uploader</li>
 * </ul>
 */
@Value
public class MaterialUploadedEvent {
    UUID materialId;
    UUID userId;
}
