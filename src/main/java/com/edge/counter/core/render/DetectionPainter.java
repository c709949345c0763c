package com.edge.counter.core.render;

import com.edge.counter.model.Detection;
import com.edge.counter.model.DetectionResult;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 在帧上绘制检测框、标签和统计信息
 */
public final class DetectionPainter {

    // BGR
    private static final Scalar STAFF_COLOR = new Scalar(0, 255, 0);
    private static final Scalar CUSTOMER_COLOR = new Scalar(0, 0, 255);
    private static final Scalar TEXT_COLOR = new Scalar(255, 255, 255);

    private static final int FONT = Imgproc.FONT_HERSHEY_SIMPLEX;
    private static final double LABEL_SCALE = 0.5;
    private static final double SUMMARY_SCALE = 0.7;

    private DetectionPainter() {
    }

    /**
     * 绘制到帧的副本上，原帧不变
     *
     * @return 标注后的新 Mat，调用方负责释放
     */
    public static Mat annotate(Mat frame, DetectionResult result) {
        Mat annotated = frame.clone();

        for (Detection det : result.getDetections()) {
            float[] box = det.getBbox();
            if (box == null || box.length < 4) {
                continue;
            }
            Scalar color = det.isStaff() ? STAFF_COLOR : CUSTOMER_COLOR;
            Point topLeft = new Point((int) box[0], (int) box[1]);
            Point bottomRight = new Point((int) box[2], (int) box[3]);

            Imgproc.rectangle(annotated, topLeft, bottomRight, color, 2);

            // 标签: "staff: 87%"
            String label = det.getLabel() + ": " + (int) (det.getConfidence() * 100) + "%";
            int[] baseline = new int[1];
            Size textSize = Imgproc.getTextSize(label, FONT, LABEL_SCALE, 1, baseline);

            // 文字背景
            Imgproc.rectangle(annotated,
                    new Point(topLeft.x, topLeft.y - textSize.height - 5),
                    new Point(topLeft.x + textSize.width, topLeft.y),
                    color, -1);
            Imgproc.putText(annotated, label, new Point(topLeft.x, topLeft.y - 5),
                    FONT, LABEL_SCALE, TEXT_COLOR, 1);
        }

        Imgproc.putText(annotated, summary(result), new Point(10, 30), FONT, SUMMARY_SCALE, TEXT_COLOR, 2);
        return annotated;
    }

    static String summary(DetectionResult result) {
        return "Staff: " + result.getStaffCount()
                + " | Customer: " + result.getCustomerCount()
                + " | " + (int) result.getElapsedMs() + "ms";
    }
}
