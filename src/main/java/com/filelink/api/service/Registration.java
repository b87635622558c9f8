package com.filelink.api.service;

import com.filelink.api.model.FileRecord;
import lombok.Value;

@Value
public class Registration {

    FileRecord file;

    String token;

    String downloadUrl;
}
