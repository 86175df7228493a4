package work.lcod.conveyor.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.conveyor.schema.GearmotorMountingStyle;

class DriveFormulasTest {
    @Test
    void speedAndRpmAreInverses() {
        double fpm = 100 * Math.PI * (4.0 / 12);
        assertEquals(100.0, DriveFormulas.driveShaftRpm(fpm, 4), 1e-9);
        assertEquals(fpm, DriveFormulas.beltSpeed(100, 4), 1e-9);
    }

    @Test
    void zeroDiameterOrSpeedIsGuarded() {
        assertEquals(0.0, DriveFormulas.driveShaftRpm(100, 0));
        assertEquals(0.0, DriveFormulas.gearRatio(1750, 0));
        assertEquals(0.0, DriveFormulas.capacity(100, 0));
        assertEquals(0.0, DriveFormulas.rpmRequired(100, 24, 0));
    }

    @Test
    void torqueAppliesSafetyFactorAtPulleyRadius() {
        assertEquals(400.0, DriveFormulas.torqueDriveShaft(100, 4, 2));
    }

    @Test
    void chainRatioOnlyForBottomMount() {
        assertEquals(1.0, DriveFormulas.chainRatio(GearmotorMountingStyle.SHAFT_MOUNTED, 18, 36));
        assertEquals(2.0, DriveFormulas.chainRatio(GearmotorMountingStyle.BOTTOM_MOUNT, 18, 36));
    }

    @Test
    void throughputTargetsIncludeMargin() {
        assertEquals(3000.0, DriveFormulas.capacity(100, 24));
        assertEquals(1100.0, DriveFormulas.targetThroughput(1000, 10), 1e-9);
        assertEquals(50.0, DriveFormulas.marginAchieved(1500, 1000), 1e-9);
        double rpm = DriveFormulas.rpmRequired(3000, 24, 4);
        assertEquals(DriveFormulas.driveShaftRpm(100, 4), rpm, 1e-9);
    }
}
