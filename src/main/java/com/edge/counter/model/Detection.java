package com.edge.counter.model;

import java.util.Arrays;

public class Detection {
    public static final int STAFF_CLASS_ID = 0;

    private String label;     // 类别名称
    private int classId;      // 类别ID (0=staff, 其他=customer)
    private float[] bbox;     // [x1, y1, x2, y2] 左上角和右下角坐标
    private float confidence; // 置信度

    public Detection(String label, int classId, float[] bbox, float confidence) {
        this.label = label;
        this.classId = classId;
        this.bbox = bbox;
        this.confidence = confidence;
    }

    public String getLabel() { return label; }
    public int getClassId() { return classId; }
    public float[] getBbox() { return bbox; }
    public float getConfidence() { return confidence; }

    public boolean isStaff() {
        return classId == STAFF_CLASS_ID;
    }

    @Override
    public String toString() {
        return "Detection{" +
                "label='" + label + '\'' +
                ", id=" + classId +
                ", conf=" + confidence +
                ", bbox=" + Arrays.toString(bbox) +
                '}';
    }
}
