package com.edge.counter.core.infer;

import ai.onnxruntime.OrtException;
import com.edge.counter.model.Detection;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

public class YOLOInferenceEngine extends InferEngineTemplate {

    private final float confThreshold;
    private final float nmsThreshold;

    public YOLOInferenceEngine(String modelPath, float conf, float nms, String device, List<String> classNames) throws OrtException {
        super(modelPath, device, classNames);
        this.confThreshold = conf;
        this.nmsThreshold = nms;
    }

    @Override
    protected PreProcessResult preprocess(Mat img) {
        int width = img.cols();
        int height = img.rows();

        // 1. 计算 Letterbox 参数
        float scale = Math.min((float) inputW / width, (float) inputH / height);
        int newW = Math.round(width * scale);
        int newH = Math.round(height * scale);
        float dw = (inputW - newW) / 2.0f;
        float dh = (inputH - newH) / 2.0f;

        Mat resized = new Mat();
        Mat padded = new Mat();
        try {
            // 2. Resize + Padding
            Imgproc.resize(img, resized, new Size(newW, newH));
            int top = Math.round(dh - 0.1f);
            int bottom = Math.round(dh + 0.1f);
            int left = Math.round(dw - 0.1f);
            int right = Math.round(dw + 0.1f);
            Core.copyMakeBorder(resized, padded, top, bottom, left, right,
                    Core.BORDER_CONSTANT, new Scalar(114, 114, 114));

            // 3. BGR -> RGB
            Imgproc.cvtColor(padded, padded, Imgproc.COLOR_BGR2RGB);

            // 一次性读取所有字节，避免逐像素 JNI 调用
            int area = padded.rows() * padded.cols();
            byte[] srcData = new byte[area * padded.channels()];
            padded.get(0, 0, srcData);

            // HWC -> CHW 并归一化
            float[] pixels = new float[3 * area];
            for (int i = 0; i < area; i++) {
                pixels[i] = (srcData[i * 3] & 0xFF) / 255.0f;
                pixels[i + area] = (srcData[i * 3 + 1] & 0xFF) / 255.0f;
                pixels[i + 2 * area] = (srcData[i * 3 + 2] & 0xFF) / 255.0f;
            }

            PreProcessResult result = new PreProcessResult();
            result.pixelData = pixels;
            result.ratio = scale;
            result.dw = dw;
            result.dh = dh;
            return result;
        } finally {
            resized.release();
            padded.release();
        }
    }

    @Override
    protected List<Detection> postprocess(float[][] outputData, PreProcessResult preResult) {
        // outputData 结构: [4 + numClasses][anchors]
        // Row 0-3: x, y, w, h; 之后是各类别分数
        int numClasses = outputData.length - 4;
        int numAnchors = outputData[0].length;

        // 候选框: [x1, y1, x2, y2, score, classId]
        List<float[]> candidates = new ArrayList<>();

        for (int i = 0; i < numAnchors; i++) {
            float maxScore = -Float.MAX_VALUE;
            int maxClassId = -1;
            for (int c = 0; c < numClasses; c++) {
                float score = outputData[4 + c][i];
                if (score > maxScore) {
                    maxScore = score;
                    maxClassId = c;
                }
            }

            if (maxScore < confThreshold) continue;

            float x = outputData[0][i];
            float y = outputData[1][i];
            float w = outputData[2][i];
            float h = outputData[3][i];

            candidates.add(new float[]{x - w * 0.5f, y - h * 0.5f, x + w * 0.5f, y + h * 0.5f, maxScore, maxClassId});
        }

        return nms(candidates, preResult);
    }

    /**
     * 同类别 NMS，输出坐标还原到原图
     */
    private List<Detection> nms(List<float[]> bboxes, PreProcessResult pre) {
        List<Detection> results = new ArrayList<>();
        if (bboxes.isEmpty()) return results;

        bboxes.sort((a, b) -> Float.compare(b[4], a[4]));

        int size = bboxes.size();
        boolean[] suppressed = new boolean[size];

        for (int i = 0; i < size; i++) {
            if (suppressed[i]) continue;

            float[] best = bboxes.get(i);

            // 坐标还原: (x - dw) / ratio
            float x1 = (best[0] - pre.dw) / pre.ratio;
            float y1 = (best[1] - pre.dh) / pre.ratio;
            float x2 = (best[2] - pre.dw) / pre.ratio;
            float y2 = (best[3] - pre.dh) / pre.ratio;

            results.add(new Detection(getLabelName((int) best[5]), (int) best[5], new float[]{x1, y1, x2, y2}, best[4]));

            for (int j = i + 1; j < size; j++) {
                if (suppressed[j]) continue;
                float[] curr = bboxes.get(j);
                if ((int) best[5] != (int) curr[5]) continue;
                if (computeIoU(best, curr) > nmsThreshold) {
                    suppressed[j] = true;
                }
            }
        }
        return results;
    }

    static float computeIoU(float[] boxA, float[] boxB) {
        float xA = Math.max(boxA[0], boxB[0]);
        float yA = Math.max(boxA[1], boxB[1]);
        float xB = Math.min(boxA[2], boxB[2]);
        float yB = Math.min(boxA[3], boxB[3]);

        float interArea = Math.max(0, xB - xA) * Math.max(0, yB - yA);
        if (interArea <= 0) return 0f;

        float boxAArea = (boxA[2] - boxA[0]) * (boxA[3] - boxA[1]);
        float boxBArea = (boxB[2] - boxB[0]) * (boxB[3] - boxB[1]);

        return interArea / (boxAArea + boxBArea - interArea);
    }
}
