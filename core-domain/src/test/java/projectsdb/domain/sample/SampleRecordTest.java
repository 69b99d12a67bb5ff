package projectsdb.domain.sample;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleRecordTest {

    @Test
    @DisplayName("Una fila con banda o profundidad NaN se considera incompleta")
    void hasMissingValue_detectsNaN() {
        assertThat(new SampleRecord(new double[]{1, Double.NaN}, 0, 0, -2).hasMissingValue()).isTrue();
        assertThat(new SampleRecord(new double[]{1, 2}, 0, 0, Double.NaN).hasMissingValue()).isTrue();
        assertThat(new SampleRecord(new double[]{1, 2}, 0, 0, -2).hasMissingValue()).isFalse();
    }

    @Test
    @DisplayName("Dos filas con los mismos valores son iguales")
    void equals_comparesArrayContent() {
        SampleRecord a = new SampleRecord(new double[]{1, 2}, 3, 4, -5);
        SampleRecord b = new SampleRecord(new double[]{1, 2}, 3, 4, -5);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.withDepth(5)).isNotEqualTo(b);
    }

    @Test
    @DisplayName("La partición expone matrices de bandas y vectores de profundidad")
    void splitResult_exposesMatrices() {
        SplitResult split = new SplitResult(
                List.of(new SampleRecord(new double[]{1, 2}, 0, 0, -1), new SampleRecord(new double[]{3, 4}, 0, 0, -2)),
                List.of(new SampleRecord(new double[]{5, 6}, 0, 0, -3)));

        assertThat(split.trainFeatures()).isDeepEqualTo(new double[][]{{1, 2}, {3, 4}});
        assertThat(split.trainTargets()).containsExactly(-1.0, -2.0);
        assertThat(split.testFeatures()).isDeepEqualTo(new double[][]{{5, 6}});
        assertThat(split.testTargets()).containsExactly(-3.0);
    }

    @Test
    @DisplayName("Los atributos no numéricos no se pueden leer como profundidad")
    void samplePoint_numericAttribute() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("z", -4);
        attributes.put("name", "reef");
        attributes.put("empty", null);
        SamplePoint point = new SamplePoint(new GeometryFactory().createPoint(new Coordinate(1, 2)), attributes);

        assertThat(point.numericAttribute("z")).isEqualTo(-4.0);
        assertThat(point.numericAttribute("empty")).isNaN();
        assertThatThrownBy(() -> point.numericAttribute("name")).isInstanceOf(IllegalArgumentException.class);
    }
}
