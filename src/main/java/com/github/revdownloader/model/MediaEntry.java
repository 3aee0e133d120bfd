package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MediaEntry {

    private String url;
    private String title;
    private String uploader;
}
