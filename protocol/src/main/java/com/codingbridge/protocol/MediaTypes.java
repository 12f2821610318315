package com.codingbridge.protocol;

import java.nio.charset.StandardCharsets;

/** Image media type sniffing from magic bytes. Defaults to JPEG. */
public final class MediaTypes {

    public static final String PNG  = "image/png";
    public static final String GIF  = "image/gif";
    public static final String WEBP = "image/webp";
    public static final String HEIC = "image/heic";
    public static final String JPEG = "image/jpeg";

    private MediaTypes() {}

    public static String detect(byte[] data) {
        if (data == null || data.length < 4) return JPEG;

        int b0 = data[0] & 0xFF, b1 = data[1] & 0xFF, b2 = data[2] & 0xFF, b3 = data[3] & 0xFF;

        if (b0 == 0x89 && b1 == 0x50 && b2 == 0x4E && b3 == 0x47) return PNG;
        if (b0 == 0x47 && b1 == 0x49 && b2 == 0x46 && b3 == 0x38) return GIF;
        // RIFF....WEBP
        if (b0 == 0x52 && b1 == 0x49 && b2 == 0x46 && b3 == 0x46 && data.length >= 12
                && data[8] == 0x57 && data[9] == 0x45 && data[10] == 0x42 && data[11] == 0x50) {
            return WEBP;
        }
        if (isHeic(data)) return HEIC;
        return JPEG;
    }

    /** ISO-BMFF: bytes 4..8 are "ftyp", 8..12 the major brand. */
    static boolean isHeic(byte[] data) {
        if (data.length < 12) return false;
        String box = new String(data, 4, 4, StandardCharsets.US_ASCII);
        if (!box.equals("ftyp")) return false;
        String brand = new String(data, 8, 4, StandardCharsets.US_ASCII);
        return switch (brand) {
            case "heic", "heix", "hevc", "hevx", "mif1", "msf1" -> true;
            default -> false;
        };
    }
}
