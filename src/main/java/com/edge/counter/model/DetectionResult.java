package com.edge.counter.model;

import java.util.Collections;
import java.util.List;

/**
 * 一次推理的结果
 */
public class DetectionResult {
    private final List<Detection> detections;
    private final int staffCount;
    private final int customerCount;
    private final double elapsedMs;

    public DetectionResult(List<Detection> detections, int staffCount, int customerCount, double elapsedMs) {
        this.detections = detections != null ? Collections.unmodifiableList(detections) : Collections.emptyList();
        this.staffCount = staffCount;
        this.customerCount = customerCount;
        this.elapsedMs = elapsedMs;
    }

    /**
     * 按类别统计员工/顾客数量
     */
    public static DetectionResult of(List<Detection> detections, double elapsedMs) {
        int staff = 0;
        int customer = 0;
        for (Detection d : detections) {
            if (d.isStaff()) {
                staff++;
            } else {
                customer++;
            }
        }
        return new DetectionResult(detections, staff, customer, elapsedMs);
    }

    public List<Detection> getDetections() { return detections; }
    public int getStaffCount() { return staffCount; }
    public int getCustomerCount() { return customerCount; }
    public double getElapsedMs() { return elapsedMs; }
}
