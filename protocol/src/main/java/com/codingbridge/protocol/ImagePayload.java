package com.codingbridge.protocol;

import java.util.Base64;

/** Inline image attached to a command: {@code {mediaType, base64Data}}. */
public record ImagePayload(String mediaType, String base64Data) {

    public static ImagePayload of(byte[] imageData) {
        return new ImagePayload(MediaTypes.detect(imageData), Base64.getEncoder().encodeToString(imageData));
    }
}
