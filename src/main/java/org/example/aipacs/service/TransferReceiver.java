package org.example.aipacs.service;

import org.example.aipacs.dto.request.StoreInstanceRequest;

import java.io.InputStream;
import java.util.List;

public interface TransferReceiver {
    StoreResult store(StoreInstanceRequest request, InputStream payload);

    List<String> listInstanceUids(String studyUid);
}
