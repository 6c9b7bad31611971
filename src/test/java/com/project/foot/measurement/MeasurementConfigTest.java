package com.project.foot.measurement;

import com.project.foot.measurement.pipeline.FootMeasurementPipeline;
import com.project.foot.measurement.pipeline.MeasurementParameters;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.upload.dir=target/test-uploads",
        "app.measurement.cm-per-pixel=0.25",
        "app.measurement.canny-low-threshold=40"
})
class MeasurementConfigTest {

    @Autowired FootMeasurementPipeline pipeline;

    @Test
    void properties_flow_into_pipeline_parameters() {
        MeasurementParameters parameters = pipeline.parameters();

        assertThat(parameters.cmPerPixel()).isEqualTo(0.25);
        assertThat(parameters.cannyLowThreshold()).isEqualTo(40.0);
        assertThat(parameters.cannyHighThreshold()).isEqualTo(150.0);
        assertThat(parameters.blurKernelSize()).isEqualTo(5);
    }
}
