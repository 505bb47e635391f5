package com.phillippitts.imageoptimizer.service.transport;

import com.phillippitts.imageoptimizer.domain.ImageSettings;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.QualitySettings;
import com.phillippitts.imageoptimizer.domain.ResizeSettings;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSerializerTest {

    @Test
    void writesOneEntryPerTaskInOrder() {
        List<ImageTask> batch = List.of(
                ImageTask.of(Path.of("/in/a.png"), Path.of("/out/a.png")),
                ImageTask.of(Path.of("/in/b.jpg"), Path.of("/out/b.webp")));

        JSONArray json = BatchSerializer.toJson(batch);

        assertThat(json.length()).isEqualTo(2);
        assertThat(json.getJSONObject(0).getString("input")).isEqualTo(Path.of("/in/a.png").toString());
        assertThat(json.getJSONObject(1).getString("output")).isEqualTo(Path.of("/out/b.webp").toString());
    }

    @Test
    void writesSettingsWithExplicitNulls() {
        ImageSettings settings = new ImageSettings(
                new QualitySettings(80, 75, null, null, null),
                new ResizeSettings(1024, null, true, "width", null),
                "webp");
        ImageTask task = new ImageTask(Path.of("/in/a.png"), Path.of("/out/a.webp"), settings);

        JSONObject entry = BatchSerializer.toJson(List.of(task)).getJSONObject(0).getJSONObject("settings");

        JSONObject quality = entry.getJSONObject("quality");
        assertThat(quality.getInt("global")).isEqualTo(80);
        assertThat(quality.getInt("jpeg")).isEqualTo(75);
        assertThat(quality.has("png")).isTrue();
        assertThat(quality.isNull("png")).isTrue();

        JSONObject resize = entry.getJSONObject("resize");
        assertThat(resize.getInt("width")).isEqualTo(1024);
        assertThat(resize.isNull("height")).isTrue();
        assertThat(resize.getBoolean("maintainAspect")).isTrue();
        assertThat(resize.getString("mode")).isEqualTo("width");

        assertThat(entry.getString("outputFormat")).isEqualTo("webp");
    }

    @Test
    void serializesAsUtf8() {
        ImageTask task = ImageTask.of(Path.of("/in/café.png"), Path.of("/out/café.png"));

        byte[] bytes = BatchSerializer.serialize(List.of(task));

        String text = new String(bytes, StandardCharsets.UTF_8);
        assertThat(new JSONArray(text).getJSONObject(0).getString("input")).endsWith("café.png");
    }
}
