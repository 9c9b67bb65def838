package com.localbrowser.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 帧序列文件名的拆分结果：前缀 + 帧号 + 后缀 + "." + 扩展名。
 *
 * <p>帧号取扩展名之前的最后一段数字，例如 {@code shot/render.0001.exr}
 * 拆为 {@code shot/render.}、{@code 0001}、空后缀与 {@code exr}。</p>
 */
public record SequenceName(String prefix, String frame, String suffix, String extension) {
    private static final Pattern SEQUENCE_PATTERN =
        Pattern.compile("^(.*?)([0-9]+)([^0-9/\\\\]*)\\.([^./\\\\]+)$");
    private static final int MAX_FRAME_DIGITS = 9;
    private static final Pattern COLLAPSED_PATTERN = Pattern.compile("^.*\\[[0-9,\\-]+].*$");

    /**
     * 解析文件路径，不含帧号或帧号超出 int 范围时返回空。
     */
    public static Optional<SequenceName> parse(String path) {
        if (path == null || isCollapsed(path)) {
            return Optional.empty();
        }
        Matcher matcher = SEQUENCE_PATTERN.matcher(path);
        if (!matcher.matches() || matcher.group(2).length() > MAX_FRAME_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(new SequenceName(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)));
    }

    /**
     * 判断路径是否已经是折叠后的序列路径，例如 {@code render.[0001-0010].exr}。
     */
    public static boolean isCollapsed(String path) {
        return path != null && COLLAPSED_PATTERN.matcher(path).matches();
    }

    /**
     * 同一序列中所有帧共享的分组键。
     */
    public String groupKey() {
        return prefix + suffix + "." + extension;
    }

    /**
     * 序列的代理路径，帧号位置写作 {@code [0]}，用作侧车存储与缩略图缓存的键。
     */
    public String proxyPath() {
        return prefix + "[0]" + suffix + "." + extension;
    }

    public String pathForFrame(String frameText) {
        return prefix + frameText + suffix + "." + extension;
    }

    public String pathForFrame(int frameNumber, int padding) {
        return pathForFrame(pad(frameNumber, padding));
    }

    public String collapsedPath(String rangeString) {
        return prefix + "[" + rangeString + "]" + suffix + "." + extension;
    }

    /**
     * 把帧号列表压缩为区间字符串：{@code [1,2,3,5]} 与补零 4 得到 {@code 0001-0003,0005}。
     */
    public static String rangeString(List<Integer> frames, int padding) {
        if (frames.isEmpty()) {
            return "";
        }
        List<Integer> sortedFrames = new ArrayList<>(new TreeSet<>(frames));
        StringBuilder builder = new StringBuilder();
        int rangeStart = sortedFrames.get(0);
        int previous = rangeStart;
        for (int i = 1; i <= sortedFrames.size(); i++) {
            boolean last = i == sortedFrames.size();
            int current = last ? Integer.MIN_VALUE : sortedFrames.get(i);
            if (!last && current == previous + 1) {
                previous = current;
                continue;
            }
            if (builder.length() > 0) {
                builder.append(',');
            }
            builder.append(pad(rangeStart, padding));
            if (previous != rangeStart) {
                builder.append('-').append(pad(previous, padding));
            }
            rangeStart = current;
            previous = current;
        }
        return builder.toString();
    }

    static String pad(int frameNumber, int padding) {
        String text = Integer.toString(frameNumber);
        if (text.length() >= padding) {
            return text;
        }
        return "0".repeat(padding - text.length()) + text;
    }
}
