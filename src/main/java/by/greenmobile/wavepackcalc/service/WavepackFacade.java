package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.config.WavepackProperties;
import by.greenmobile.wavepackcalc.entity.FluidProperties;
import by.greenmobile.wavepackcalc.entity.GeometrySpec;
import by.greenmobile.wavepackcalc.entity.MaterialProperties;
import by.greenmobile.wavepackcalc.entity.OperatingConditions;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.TemperaturePoint;
import by.greenmobile.wavepackcalc.entity.TemperatureProfile;
import by.greenmobile.wavepackcalc.entity.TemperatureSample;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.entity.WeightUnit;
import by.greenmobile.wavepackcalc.service.engine.ArraySynthesis;
import by.greenmobile.wavepackcalc.service.engine.ArraySynthesizer;
import by.greenmobile.wavepackcalc.service.engine.TemperatureInterpolator;
import by.greenmobile.wavepackcalc.service.engine.Units;
import by.greenmobile.wavepackcalc.service.library.PropertyLibrary;
import by.greenmobile.wavepackcalc.service.physics.AttenuationModel;
import by.greenmobile.wavepackcalc.service.physics.AttenuationResult;
import by.greenmobile.wavepackcalc.service.physics.FlowResult;
import by.greenmobile.wavepackcalc.service.physics.FlowSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single entry point of a wavepack solve:
 * - normalises input (InputNormalizer)
 * - resolves material / fluid (PropertyLibrary)
 * - collapses the temperature range into mean rho / mu (TemperatureInterpolator)
 * - sizes the array, runs flow and attenuation for one representative channel
 * - synthesises layout, envelope and mass (ArraySynthesizer)
 *
 * Stateless: every call is independent, the first error aborts the call and nothing partial is returned.
 */
@Service
@Slf4j
public class WavepackFacade {

    private final InputNormalizer inputNormalizer;
    private final PropertyLibrary library;
    private final TemperatureInterpolator interpolator;
    private final FlowSolver flowSolver;
    private final AttenuationModel attenuationModel;
    private final ArraySynthesizer synthesizer;

    private final int temperatureSamples;
    private final List<Double> frequencies;

    public WavepackFacade(InputNormalizer inputNormalizer,
                          PropertyLibrary library,
                          TemperatureInterpolator interpolator,
                          FlowSolver flowSolver,
                          AttenuationModel attenuationModel,
                          ArraySynthesizer synthesizer,
                          WavepackProperties props) {
        this.inputNormalizer = inputNormalizer;
        this.library = library;
        this.interpolator = interpolator;
        this.flowSolver = flowSolver;
        this.attenuationModel = attenuationModel;
        this.synthesizer = synthesizer;
        this.temperatureSamples = props.getTemperature().getSamples();
        this.frequencies = AttenuationModel.decadeSweep(props.getSweep().getStartDecade(), props.getSweep().getEndDecade());
    }

    public SolveResult solve(WavepackParameters params) {
        log.info("Solve start: {}", params);

        // 1) units
        NormalizedInput in = inputNormalizer.normalize(params);
        GeometrySpec g = in.getGeometry();
        OperatingConditions op = in.getConditions();

        // 2) library
        MaterialProperties material = library.lookupMaterial(in.getMaterial());
        FluidProperties fluid = library.lookupFluid(in.getFluid());

        // 3) representative fluid point
        TemperatureProfile profile = interpolator.interpolate(
                fluid, op.getMinTemperatureF(), op.getMaxTemperatureF(), temperatureSamples);
        double rho = profile.getMeanDensity();
        double mu = profile.getMeanViscosity();

        // 4) shape
        double dh = synthesizer.hydraulicDiameter(g);
        double openRatio = g.getShape().getOpenAreaRatio();

        // 5) sizing heuristic
        int required = synthesizer.requiredChannelCount(openRatio, op.getPressureDropLimit(), rho, op.getTargetVelocity());

        // 6) flow, one channel stands for all
        FlowResult flow = flowSolver.solveChannel(rho, mu, op.getTargetVelocity(), g.getLength(), dh, material.getRoughness());
        List<TemperaturePoint> sweep = temperatureSweep(profile, op, g, dh, material);

        // 7) shielding
        AttenuationResult att = attenuationModel.attenuate(g, material, frequencies);

        // 8) layout + mass
        ArraySynthesis array = synthesizer.synthesize(g, material, required);

        // 9) result
        double massKg = array.getMass();
        SolveResult result = SolveResult.builder()
                .arrayDims(List.of(array.getLayout().getRows(), array.getLayout().getColumns()))
                .velocityFts(Units.metersPerSecondToFeetPerSecond(op.getTargetVelocity()))
                .deltaPPsi(Units.pascalToPsi(flow.getPressureDrop()))
                .cutoffGhz(att.getCutoffFrequency() / 1e9)
                .shieldingDb(att.getShieldingDb())
                .frequencies(att.getFrequencies())
                .totalWeightLbm(WeightUnit.LBM.fromKilograms(massKg))
                .widthIn(Units.metersToInches(g.getWidth()))
                .heightIn(Units.metersToInches(g.getHeight()))
                .wallThicknessIn(Units.metersToInches(g.getWallThickness()))
                .lengthFt(Units.metersToFeet(g.getLength()))
                .shape(g.getShape().getLabel())
                .material(material.getName())
                .fluid(fluid.getName())
                .reynolds(flow.getReynolds())
                .frictionFactor(flow.getFrictionFactor())
                .flowRegime(flow.regime())
                .hydraulicDiameterIn(Units.metersToInches(dh))
                .openAreaRatio(openRatio)
                .channelsRequired(required)
                .channelsProvisioned(array.getLayout().getProvisionedChannels())
                .channelShortfall(array.getLayout().getShortfall())
                .envelopeWidthIn(Units.metersToInches(array.getEnvelopeWidth()))
                .envelopeHeightIn(Units.metersToInches(array.getEnvelopeHeight()))
                .meanDensity(rho)
                .meanViscosity(mu)
                .totalWeight(in.getWeightUnit().fromKilograms(massKg))
                .weightUnit(in.getWeightUnit())
                .temperatureSweep(sweep)
                .build();

        log.info("Solve done: {} {} / {}: array={}x{} (N={}), Re={} ({}), dP={} psi, fc={} GHz, weight={} lbm",
                g.getShape().getLabel(), fluid.getName(), material.getName(),
                result.getRows(), result.getColumns(), required, flow.getReynolds(), flow.regime(),
                result.getDeltaPPsi(), result.getCutoffGhz(), result.getTotalWeightLbm());
        return result;
    }

    /**
     * Same channel, same velocity, evaluated at every sample of the profile instead of the mean.
     */
    private List<TemperaturePoint> temperatureSweep(TemperatureProfile profile, OperatingConditions op,
                                                    GeometrySpec g, double dh, MaterialProperties material) {
        List<TemperaturePoint> out = new ArrayList<>(profile.size());
        for (TemperatureSample s : profile.getSamples()) {
            FlowResult fr = flowSolver.solveChannel(s.getDensity(), s.getViscosity(), op.getTargetVelocity(),
                    g.getLength(), dh, material.getRoughness());
            out.add(TemperaturePoint.builder()
                    .temperatureF(Units.kelvinToFahrenheit(s.getTemperature()))
                    .density(s.getDensity())
                    .viscosity(s.getViscosity())
                    .reynolds(fr.getReynolds())
                    .pressureDropPsi(Units.pascalToPsi(fr.getPressureDrop()))
                    .build());
        }
        return List.copyOf(out);
    }
}
