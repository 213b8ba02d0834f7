package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.queue.QueuedOperation;

import java.util.List;

public record QueueStateResponse(int size, List<QueuedOperation> operations) {
}
