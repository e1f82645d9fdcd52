package com.hydromat.tooling.service;

import com.hydromat.tooling.dto.MaterialSizeRequest;
import com.hydromat.tooling.dto.ProductVariantRequest;
import com.hydromat.tooling.dto.ProfileRequest;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.model.MaterialSize;
import com.hydromat.tooling.model.ProductSizeVariant;
import com.hydromat.tooling.model.Profile;
import com.hydromat.tooling.repository.MaterialSizeRepository;
import com.hydromat.tooling.repository.ProductSizeVariantRepository;
import com.hydromat.tooling.repository.ProfileRepository;
import com.hydromat.tooling.security.Permissions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class SizeServiceTest {

    @Autowired
    private SizeService sizeService;

    @Autowired
    private ProfileService profileService;

    @Autowired
    private MaterialSizeRepository materialSizeRepository;

    @Autowired
    private ProductSizeVariantRepository variantRepository;

    @Autowired
    private ProfileRepository profileRepository;

    private Profile profile;

    @BeforeEach
    void setUp() {
        ProfileRequest request = new ProfileRequest();
        request.setName("Decking " + UUID.randomUUID());
        profile = profileService.createProfile(request, Permissions.FULL_ACCESS);
    }

    @AfterEach
    void cleanUp() {
        variantRepository.deleteAll();
        profileRepository.deleteAll();
        materialSizeRepository.deleteAll();
    }

    @Test
    void addMaterialSize_namesByDimensionsAndReusesExistingPair() {
        MaterialSize first = sizeService.addMaterialSize(material(18.0, 40.0), Permissions.FULL_ACCESS);
        MaterialSize again = sizeService.addMaterialSize(material(18.0, 40.0), Permissions.FULL_ACCESS);
        sizeService.addMaterialSize(material(12.0, 60.0), Permissions.FULL_ACCESS);

        assertThat(first.getName()).isEqualTo("18 x 40");
        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(sizeService.getAllMaterialSizes())
                .extracting(MaterialSize::getWidth)
                .containsExactly(12.0, 18.0);
    }

    @Test
    void addMaterialSize_rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> sizeService.addMaterialSize(material(0.0, 40.0), Permissions.FULL_ACCESS))
                .isInstanceOf(InventoryValidationException.class)
                .hasMessage("Width must be greater than 0");
    }

    @Test
    void variants_singleDefaultPerProfile() {
        ProductSizeVariant first = sizeService.addVariant(profile.getId(), variant(90.0, true), Permissions.FULL_ACCESS);
        ProductSizeVariant second = sizeService.addVariant(profile.getId(), variant(70.0, true), Permissions.FULL_ACCESS);

        assertThat(variantRepository.findById(first.getId()).orElseThrow().isDefaultVariant()).isFalse();
        assertThat(sizeService.getDefaultVariant(profile.getId()))
                .get()
                .extracting(ProductSizeVariant::getId)
                .isEqualTo(second.getId());
        assertThat(second.getTolerance()).isEqualTo(0.5);
    }

    @Test
    void defaultVariant_fallsBackToFirstAndDeleteRemoves() {
        ProductSizeVariant first = sizeService.addVariant(profile.getId(), variant(90.0, false), Permissions.FULL_ACCESS);
        ProductSizeVariant second = sizeService.addVariant(profile.getId(), variant(45.0, false), Permissions.FULL_ACCESS);

        assertThat(sizeService.getDefaultVariant(profile.getId())).get()
                .extracting(ProductSizeVariant::getId).isEqualTo(first.getId());
        assertThat(sizeService.formatVariants(profile.getId())).isEqualTo("90 mm (±0.5); 45 mm (±0.5)");

        sizeService.deleteVariant(first.getId(), Permissions.FULL_ACCESS);

        assertThat(sizeService.getVariantsForProfile(profile.getId()))
                .extracting(ProductSizeVariant::getId)
                .containsExactly(second.getId());
    }

    private static MaterialSizeRequest material(double width, double thickness) {
        MaterialSizeRequest request = new MaterialSizeRequest();
        request.setWidth(width);
        request.setThickness(thickness);
        return request;
    }

    private static ProductVariantRequest variant(double width, boolean isDefault) {
        ProductVariantRequest request = new ProductVariantRequest();
        request.setWidth(width);
        request.setDefaultVariant(isDefault);
        return request;
    }
}
