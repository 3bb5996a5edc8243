package org.safeshipper.engine.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.safeshipper.engine.TestData;
import org.safeshipper.engine.domain.model.CertificateType;
import org.safeshipper.engine.domain.model.DgItem;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.domain.model.DriverCertificate;
import org.safeshipper.engine.domain.model.DriverCompetencyProfile;
import org.safeshipper.engine.domain.model.DriverCompetencyRecord;
import org.safeshipper.engine.domain.model.DriverLicense;
import org.safeshipper.engine.domain.model.DriverQualificationResult;
import org.safeshipper.engine.domain.model.DriverSnapshot;
import org.safeshipper.engine.domain.model.LicenseClass;
import org.safeshipper.engine.domain.model.QualificationLevel;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.safeshipper.engine.TestData.TODAY;

class DriverQualificationValidatorTest {

    private DriverQualificationValidator validator;
    private DangerousGoodsAggregator aggregator;

    @BeforeEach
    void setUp() {
        validator = new DriverQualificationValidator(30);
        aggregator = new DangerousGoodsAggregator(TestData.registry().getHazardClasses());
    }

    private DgProfile profileOf(DgItem... items) {
        return aggregator.aggregate(Arrays.asList(items));
    }

    private DgProfile flammable() {
        return profileOf(TestData.dangerousItem("1", "UN1203", "3", 100.0));
    }

    @Nested
    @DisplayName("dangerous goods certificates")
    class Certificates {

        @Test
        void shouldQualifyDriverWithValidCertificate() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.isOverallQualified()).isTrue();
            assertThat(result.getCriticalIssues()).isEmpty();
            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getQualifiedClasses()).containsExactly(entry("3", true));
            assertThat(result.getQualificationLevel()).isEqualTo(QualificationLevel.DANGEROUS_GOODS);
        }

        @Test
        void shouldWarnAboutCertificateExpiringSoon() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusDays(10), "3"))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.isOverallQualified()).isTrue();
            assertThat(result.getWarnings())
                    .containsExactly("Dangerous goods certificate DG-3 for Class 3 expires on 2026-10-29");
        }

        @Test
        void shouldRejectDriverWithoutCertificate() {
            DriverQualificationResult result = validator.validate(TestData.driver("D1").build(), flammable(), TODAY);

            assertThat(result.isOverallQualified()).isFalse();
            assertThat(result.getCriticalIssues()).containsExactly("No valid dangerous goods certificate for Class 3");
            assertThat(result.getQualifiedClasses()).containsExactly(entry("3", false));
            assertThat(result.getQualificationLevel()).isEqualTo(QualificationLevel.INSUFFICIENT);
        }

        @Test
        void shouldRejectExpiredCertificate() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-3", TODAY.minusDays(10), "3"))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.getCriticalIssues())
                    .containsExactly("Dangerous goods certificate DG-3 for Class 3 expired on 2026-10-09");
        }

        @Test
        void shouldIgnoreRevokedCertificate() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(new DriverCertificate("DG-3", CertificateType.CLASS_SPECIFIC,
                            Collections.singleton("3"), TODAY.plusYears(1), true))
                    .build();

            assertThat(validator.validate(driver, flammable(), TODAY).getCriticalIssues())
                    .containsExactly("No valid dangerous goods certificate for Class 3");
        }

        @Test
        void shouldAcceptCertificateCoveringAllClasses() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-ALL", TODAY.plusYears(1), DriverCertificate.ALL_CLASSES))
                    .build();
            DgProfile profile = profileOf(
                    TestData.dangerousItem("1", "UN1203", "3", 10.0),
                    TestData.dangerousItem("2", "UN1760", "8", 10.0));

            DriverQualificationResult result = validator.validate(driver, profile, TODAY);

            assertThat(result.isOverallQualified()).isTrue();
            assertThat(result.getQualifiedClasses()).containsExactly(entry("3", true), entry("8", true));
        }

        @ParameterizedTest
        @EnumSource(value = CertificateType.class, names = "CLASS_SPECIFIC", mode = EnumSource.Mode.EXCLUDE)
        void shouldNotQualifyClassWithOtherCertificateTypes(CertificateType type) {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(new DriverCertificate("TR-1", type,
                            Collections.singleton(DriverCertificate.ALL_CLASSES), TODAY.plusYears(1), false))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.isOverallQualified()).isFalse();
            assertThat(result.getQualifiedClasses()).containsExactly(entry("3", false));
            assertThat(result.getCriticalIssues())
                    .containsExactly("No valid dangerous goods certificate for Class 3");
        }

        @Test
        void shouldCheckMainClassOfDivision() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-2", TODAY.plusYears(1), "2"))
                    .build();

            DriverQualificationResult result = validator.validate(driver,
                    profileOf(TestData.dangerousItem("1", "UN1965", "2.1", 30.0)), TODAY);

            assertThat(result.isOverallQualified()).isTrue();
            assertThat(result.getQualifiedClasses()).containsOnlyKeys("2");
        }

        @Test
        void shouldRejectRestrictedClassEvenWithCertificate() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .competency(new DriverCompetencyRecord(6.0, TODAY.plusYears(1),
                            Collections.singleton("NO_CLASS_3")))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.getCriticalIssues()).containsExactly("Driver is restricted from carrying Class 3 (NO_CLASS_3)");
            assertThat(result.getQualifiedClasses()).containsExactly(entry("3", false));
        }
    }

    @Nested
    @DisplayName("licence and medical")
    class LicenceAndMedical {

        @Test
        void shouldRejectDriverWithoutActiveLicence() {
            DriverSnapshot driver = DriverSnapshot.builder("D2")
                    .name("Sam Taylor")
                    .addLicense(new DriverLicense("L-1", LicenseClass.HR, TODAY.minusYears(3), TODAY.plusYears(1), true))
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.getCriticalIssues()).containsExactly("Driver Sam Taylor has no valid driver licence");
        }

        @Test
        void shouldWarnAboutCarLicenceForDangerousGoods() {
            DriverSnapshot driver = DriverSnapshot.builder("D2")
                    .addLicense(new DriverLicense("L-1", LicenseClass.C, TODAY.minusYears(3), TODAY.plusYears(1)))
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.isOverallQualified()).isTrue();
            assertThat(result.getWarnings()).containsExactly(
                    "Licence class C is not suitable for dangerous goods transport; a heavy vehicle class is required");
        }

        @Test
        void shouldWarnAboutLicenceExpiringSoon() {
            DriverSnapshot driver = DriverSnapshot.builder("D2")
                    .addLicense(new DriverLicense("L-1", LicenseClass.MC, TODAY.minusYears(3), TODAY.plusDays(5)))
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .build();

            assertThat(validator.validate(driver, flammable(), TODAY).getWarnings())
                    .containsExactly("Licence L-1 expires on 2026-10-24");
        }

        @Test
        void shouldRejectExpiredMedical() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .competency(new DriverCompetencyRecord(6.0, TODAY.minusDays(1), null))
                    .build();

            DriverQualificationResult result = validator.validate(driver, flammable(), TODAY);

            assertThat(result.getCriticalIssues()).containsExactly("Medical certificate expired on 2026-10-18");
            assertThat(result.getQualifiedClasses()).containsExactly(entry("3", true));
        }

        @Test
        void shouldWarnAboutMedicalExpiringSoon() {
            DriverSnapshot driver = TestData.driver("D1")
                    .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                    .competency(new DriverCompetencyRecord(6.0, TODAY.plusDays(20), null))
                    .build();

            assertThat(validator.validate(driver, flammable(), TODAY).getWarnings())
                    .containsExactly("Medical certificate expires on 2026-11-08");
        }
    }

    @Nested
    @DisplayName("general freight")
    class GeneralFreight {

        @Test
        void shouldOnlyRequireLicence() {
            DgProfile profile = profileOf(TestData.generalItem("1", 300.0));

            DriverQualificationResult result = validator.validate(TestData.driver("D1").build(), profile, TODAY);

            assertThat(result.isOverallQualified()).isTrue();
            assertThat(result.getQualifiedClasses()).isEmpty();
            assertThat(result.getQualificationLevel()).isEqualTo(QualificationLevel.BASIC);
        }

        @Test
        void shouldRecommendCommercialLicence() {
            DriverSnapshot driver = DriverSnapshot.builder("D2")
                    .addLicense(new DriverLicense("L-1", LicenseClass.C, TODAY.minusYears(3), TODAY.plusYears(1)))
                    .build();

            DriverQualificationResult result = validator.validate(driver,
                    profileOf(TestData.generalItem("1", 300.0)), TODAY);

            assertThat(result.getWarnings())
                    .containsExactly("Only a class C licence held; upgrade to a commercial licence class recommended");
        }
    }

    @Test
    void shouldCountBasicCertificateInProfileOnly() {
        DriverSnapshot driver = TestData.driver("D1")
                .addCertificate(new DriverCertificate("ADG-1", CertificateType.BASIC_ADG,
                        Collections.singleton("3"), TODAY.plusYears(1), false))
                .addCertificate(new DriverCertificate("LR-1", CertificateType.LOAD_RESTRAINT,
                        Collections.singleton("8"), TODAY.plusYears(1), false))
                .build();

        DriverCompetencyProfile profile = validator.buildCompetencyProfile(driver, TODAY);

        assertThat(profile.isBaseCertificateCheckPassed()).isTrue();
        assertThat(profile.getQualifiedClasses()).containsExactly("3");
        assertThat(profile.getCompliancePercentage()).isEqualTo(100.0);
        assertThat(validator.validate(driver, flammable(), TODAY).isOverallQualified()).isFalse();
    }

    @Test
    void shouldBuildCompetencyProfile() {
        DriverSnapshot driver = TestData.driver("D1")
                .addCertificate(TestData.certificate("DG-3", TODAY.plusYears(1), "3"))
                .addCertificate(TestData.certificate("DG-8", TODAY.minusDays(1), "8"))
                .build();

        DriverCompetencyProfile profile = validator.buildCompetencyProfile(driver, TODAY);

        assertThat(profile.getQualifiedClasses()).containsExactly("3");
        assertThat(profile.isLicenseCheckPassed()).isTrue();
        assertThat(profile.isBaseCertificateCheckPassed()).isFalse();
        assertThat(profile.getCompliancePercentage()).isEqualTo(75.0);
    }
}
