package com.edge.counter.core.infer;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxModelMetadata;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.edge.counter.model.Detection;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ONNX 推理模板：会话创建、设备选择、Metadata 类别读取；预处理/后处理由子类实现
 */
public abstract class InferEngineTemplate implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InferEngineTemplate.class);

    protected OrtEnvironment env;
    protected OrtSession session;
    protected String inputName;
    protected String[] labels; // 动态加载的标签
    protected int inputH = 640; // 默认值，也会尝试从模型读取
    protected int inputW = 640;

    public InferEngineTemplate(String modelPath, String device, List<String> fallbackLabels) throws OrtException {
        // 1. 初始化环境
        this.env = OrtEnvironment.getEnvironment();

        // 2. 配置设备 (GPU/CPU) 并创建 Session
        this.session = env.createSession(modelPath, createSessionOptions(device));

        // 3. 获取输入节点名称和尺寸
        this.inputName = session.getInputNames().iterator().next();
        Map<String, NodeInfo> inputInfo = session.getInputInfo();
        long[] shape = ((TensorInfo) inputInfo.get(inputName).getInfo()).getShape();
        // 动态尺寸为 -1 时保持默认 640
        if (shape.length == 4) {
            if (shape[2] > 0) this.inputH = (int) shape[2];
            if (shape[3] > 0) this.inputW = (int) shape[3];
        }

        // 4. 类别名称：优先读模型 Metadata，其次使用配置
        loadMetadata();
        if (labels == null && fallbackLabels != null && !fallbackLabels.isEmpty()) {
            labels = fallbackLabels.toArray(new String[0]);
            logger.info("Using configured class names: {}", Arrays.toString(labels));
        }
    }

    /**
     * 创建 SessionOptions，GPU 不可用时退回 CPU
     */
    private OrtSession.SessionOptions createSessionOptions(String device) throws OrtException {
        OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

        if ("GPU".equalsIgnoreCase(device)) {
            try {
                opts.addCUDA(0);
                opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
                opts.setExecutionMode(OrtSession.SessionOptions.ExecutionMode.SEQUENTIAL);
                logger.info("GPU (CUDA) provider enabled, device 0");
            } catch (OrtException e) {
                logger.warn("CUDA initialization failed, falling back to CPU: {}", e.getMessage());
                opts.close();
                opts = new OrtSession.SessionOptions();
            }
        } else {
            logger.info("Using CPU execution");
        }

        return opts;
    }

    /**
     * 从 ONNX Metadata 读取 names 字段，格式 {0: 'staff', 1: 'customer'}
     */
    private void loadMetadata() {
        try {
            OnnxModelMetadata metadata = session.getMetadata();
            String metaStr = metadata.getCustomMetadata().get("names");

            if (metaStr != null && !metaStr.isEmpty()) {
                List<String> labelList = new ArrayList<>();
                Matcher matcher = Pattern.compile("'([^']*)'").matcher(metaStr);
                while (matcher.find()) {
                    labelList.add(matcher.group(1));
                }
                this.labels = labelList.toArray(new String[0]);
                logger.info("Model class names loaded: {}", Arrays.toString(this.labels));
            } else {
                logger.warn("No 'names' found in model metadata");
            }
        } catch (OrtException e) {
            logger.warn("Failed to read model metadata: {}", e.getMessage());
            this.labels = null;
        }
    }

    /**
     * 推理主入口
     */
    public List<Detection> predict(Mat img) throws OrtException {
        // 1. 预处理 (Letterbox + Normalize)
        PreProcessResult preResult = preprocess(img);

        // 2. 创建 Tensor 并运行
        long[] shape = {1L, 3L, inputH, inputW};
        try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(preResult.pixelData), shape);
             OrtSession.Result result = session.run(Collections.singletonMap(inputName, tensor))) {

            // YOLO 输出 [1, 4 + numClasses, anchors]
            float[][] outputData = ((float[][][]) result.get(0).getValue())[0];

            // 3. 后处理 (NMS + 坐标还原)
            return postprocess(outputData, preResult);
        }
    }

    // 在该类和子类之间传递预处理参数
    protected static class PreProcessResult {
        public float[] pixelData; // 归一化后的像素
        public float ratio;       // 缩放比例
        public float dw;          // x轴填充偏移
        public float dh;          // y轴填充偏移
    }

    protected abstract PreProcessResult preprocess(Mat img);

    protected abstract List<Detection> postprocess(float[][] output, PreProcessResult preResult);

    @Override
    public void close() {
        try {
            if (session != null) session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close ONNX session: {}", e.getMessage());
        }
    }

    protected String getLabelName(int id) {
        if (labels != null && id >= 0 && id < labels.length) {
            return labels[id];
        }
        return String.valueOf(id);
    }

    public int getInputWidth() {
        return inputW;
    }

    public int getInputHeight() {
        return inputH;
    }
}
