package com.cred.freestyle.warranty.domain.model;

import java.util.Locale;

/**
 * Bill (proof of purchase) file: an upload submitted with a registration, or a
 * stored bill loaded for download.
 *
 * @author Warranty Platform Team
 */
public class EvidenceFile {

    private final String originalFilename;
    private final String contentType;
    private final byte[] content;

    public EvidenceFile(String originalFilename, String contentType, byte[] content) {
        this.originalFilename = originalFilename;
        this.contentType = contentType;
        this.content = content == null ? new byte[0] : content;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getContent() {
        return content;
    }

    public long getSize() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    /**
     * Lower-case extension of the original filename without the dot, or an
     * empty string when there is none.
     */
    public String getExtension() {
        if (originalFilename == null) {
            return "";
        }
        int dot = originalFilename.lastIndexOf('.');
        if (dot < 0 || dot == originalFilename.length() - 1) {
            return "";
        }
        return originalFilename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
