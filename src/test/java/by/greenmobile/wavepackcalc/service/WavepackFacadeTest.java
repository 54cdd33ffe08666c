package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.config.WavepackProperties;
import by.greenmobile.wavepackcalc.entity.LayoutPolicy;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.TemperaturePoint;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.entity.WeightUnit;
import by.greenmobile.wavepackcalc.exception.DomainException;
import by.greenmobile.wavepackcalc.exception.UnknownLookupException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class WavepackFacadeTest {

    /** Relative tolerance for values that go through a few transcendental calls. */
    private static void assertClose(double expected, double actual) {
        assertEquals(expected, actual, Math.abs(expected) * 1e-9);
    }

    @Test
    @DisplayName("Reference case, ROUND_UP layout")
    void referenceRoundUp() {
        // Act
        SolveResult r = WavepackFixtures.facade().solve(WavepackFixtures.reference());
        log.info("Reference result: {}", r);

        // Assert
        assertEquals(List.of(38, 38), r.getArrayDims());
        assertEquals(1419, r.getChannelsRequired());
        assertEquals(1444, r.getChannelsProvisioned());
        assertEquals(0, r.getChannelShortfall());
        assertClose(50.0, r.getVelocityFts());
        assertClose(0.001923345007174379, r.getDeltaPPsi());
        assertClose(6.439146013065995, r.getCutoffGhz());
        assertClose(776.2560843999261, r.getTotalWeightLbm());
        assertClose(26246.051669603166, r.getReynolds());
        assertClose(0.02426616984509436, r.getFrictionFactor());
        assertEquals("TURBULENT", r.getFlowRegime());
        assertClose(1.045737453406631, r.getMeanDensity());
        assertClose(2.0564402872716678e-05, r.getMeanViscosity());
        assertClose(0.5, r.getLengthFt());
        assertClose(2.0, r.getWidthIn());

        assertEquals(List.of(1e5, 1e6, 1e7, 1e8, 1e9, 1e10), r.getFrequencies());
        for (int i = 0; i < 5; i++) {
            assertClose(1.3237295808411114, r.getShieldingDb().get(i));
        }
        assertClose(217.49980537880094, r.getShieldingDb().get(5));
    }

    @Test
    @DisplayName("Zero pressure-drop budget solves to a 1 x 1 array")
    void zeroPressureBudget() {
        WavepackParameters p = WavepackFixtures.reference();
        p.setDpLimitPsi(0.0);

        SolveResult r = WavepackFixtures.facade().solve(p);

        assertEquals(List.of(1, 1), r.getArrayDims());
        assertEquals(1, r.getChannelsRequired());
        assertEquals(0, r.getChannelShortfall());
        assertTrue(r.getTotalWeightLbm() > 0);
    }

    @Test
    @DisplayName("Reference case, TRUNCATE layout: 37 x 37 with a shortfall")
    void referenceTruncate() {
        SolveResult r = WavepackFixtures.facade(LayoutPolicy.TRUNCATE).solve(WavepackFixtures.reference());

        assertEquals(List.of(37, 37), r.getArrayDims());
        assertEquals(50, r.getChannelShortfall());
        assertClose(735.9380744761052, r.getTotalWeightLbm());
        assertClose(0.001923345007174379, r.getDeltaPPsi());
    }

    @Test
    @DisplayName("Circular inline air case")
    void circularInline() {
        SolveResult r = WavepackFixtures.facade().solve(WavepackFixtures.circularInline());

        assertEquals(List.of(35, 35), r.getArrayDims());
        assertEquals(1180, r.getChannelsRequired());
        assertClose(0.0018733152424462868, r.getDeltaPPsi());
        assertClose(13.83499482677089, r.getCutoffGhz());
        assertClose(66.93900829637171, r.getTotalWeightLbm());
        assertClose(6456.867607347536, r.getReynolds());
        // b_in is reported as the diameter
        assertClose(0.5, r.getHeightIn());
        r.getShieldingDb().forEach(se -> assertClose(0.8824863872274077, se));
    }

    @Test
    @DisplayName("Circular staggered water case")
    void staggeredWater() {
        SolveResult r = WavepackFixtures.facade().solve(WavepackFixtures.staggeredWater());

        assertEquals(List.of(28, 28), r.getArrayDims());
        assertEquals(739, r.getChannelsRequired());
        assertClose(0.006816728812458566, r.getDeltaPPsi());
        assertClose(42.840965309677884, r.getTotalWeightLbm());
        assertClose(6347.513746155343, r.getReynolds());
        assertClose(893.7788720840033, r.getMeanDensity());
    }

    @Test
    @DisplayName("Same input twice gives an equal result")
    void deterministic() {
        WavepackFacade facade = WavepackFixtures.facade();

        assertEquals(facade.solve(WavepackFixtures.reference()), facade.solve(WavepackFixtures.reference()));
    }

    @Test
    @DisplayName("Unknown material aborts the solve")
    void unknownMaterial() {
        WavepackParameters p = WavepackFixtures.reference();
        p.setMaterial("Unobtainium");

        UnknownLookupException ex = assertThrows(UnknownLookupException.class,
                () -> WavepackFixtures.facade().solve(p));

        assertEquals("material", ex.getField());
    }

    @Test
    @DisplayName("Temperature sweep: one point per sample, drop rises with temperature for a gas")
    void temperatureSweep() {
        SolveResult r = WavepackFixtures.facade().solve(WavepackFixtures.reference());
        List<TemperaturePoint> sweep = r.getTemperatureSweep();

        assertEquals(10, sweep.size());
        assertEquals(32.0, sweep.get(0).getTemperatureF(), 1e-9);
        assertEquals(212.0, sweep.get(9).getTemperatureF(), 1e-9);
        assertTrue(sweep.get(0).getDensity() > sweep.get(9).getDensity());
        assertTrue(sweep.get(0).getReynolds() > sweep.get(9).getReynolds());
    }

    @Test
    @DisplayName("Weight unit KG reports kilograms, lbm stays in total_weight_lbm")
    void kilograms() {
        WavepackParameters p = WavepackFixtures.reference();
        p.setWeightUnit(WeightUnit.KG);

        SolveResult r = WavepackFixtures.facade().solve(p);

        assertEquals(WeightUnit.KG, r.getWeightUnit());
        assertClose(352.10425579008, r.getTotalWeight());
        assertClose(776.2560843999261, r.getTotalWeightLbm());
    }

    @Test
    @DisplayName("Configured channel cap bounds the layout")
    void channelCap() {
        WavepackProperties props = new WavepackProperties();
        props.getSizing().setMaxChannels(100);

        SolveResult r = WavepackFixtures.facade(props).solve(WavepackFixtures.reference());

        assertEquals(List.of(10, 10), r.getArrayDims());
    }

    @Test
    @DisplayName("Absolute-zero temperature range is a domain error")
    void absoluteZero() {
        WavepackParameters p = WavepackFixtures.reference();
        p.setMinTemperatureF(-460.0);

        DomainException ex = assertThrows(DomainException.class, () -> WavepackFixtures.facade().solve(p));
        assertEquals("T_min_F", ex.getField());
    }
}
