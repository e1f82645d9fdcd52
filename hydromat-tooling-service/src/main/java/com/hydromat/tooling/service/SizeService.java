package com.hydromat.tooling.service;

import com.hydromat.tooling.dto.LegacySizeFormatter;
import com.hydromat.tooling.dto.MaterialSizeDto;
import com.hydromat.tooling.dto.MaterialSizeRequest;
import com.hydromat.tooling.dto.ProductVariantDto;
import com.hydromat.tooling.dto.ProductVariantRequest;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.model.MaterialSize;
import com.hydromat.tooling.model.ProductSizeVariant;
import com.hydromat.tooling.repository.MaterialSizeRepository;
import com.hydromat.tooling.repository.ProductSizeVariantRepository;
import com.hydromat.tooling.repository.ProfileRepository;
import com.hydromat.tooling.security.Permissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Raw material blanks and the finished product sizes of each profile.
 */
@Service
public class SizeService {

    private static final Logger logger = LoggerFactory.getLogger(SizeService.class);

    private final MaterialSizeRepository materialSizeRepository;
    private final ProductSizeVariantRepository variantRepository;
    private final ProfileRepository profileRepository;

    public SizeService(MaterialSizeRepository materialSizeRepository,
                       ProductSizeVariantRepository variantRepository,
                       ProfileRepository profileRepository) {
        this.materialSizeRepository = materialSizeRepository;
        this.variantRepository = variantRepository;
        this.profileRepository = profileRepository;
    }

    @Transactional(readOnly = true)
    public List<MaterialSize> getAllMaterialSizes() {
        return materialSizeRepository.findAllByOrderByWidthAscThicknessAsc();
    }

    @Transactional(readOnly = true)
    public Optional<MaterialSize> getMaterialSize(Long id) {
        return materialSizeRepository.findById(id);
    }

    /**
     * Adds a blank size. An existing (width, thickness) pair is returned as is.
     */
    @Transactional
    public MaterialSize addMaterialSize(MaterialSizeRequest request, Permissions permissions) {
        permissions.requireEdit();
        if (request == null) {
            throw new InventoryValidationException("Material size is required");
        }
        requirePositive("Width", request.getWidth());
        requirePositive("Thickness", request.getThickness());

        Optional<MaterialSize> existing =
                materialSizeRepository.findByWidthAndThickness(request.getWidth(), request.getThickness());
        if (existing.isPresent()) {
            logger.info("Material size {} already exists with ID {}",
                    LegacySizeFormatter.materialSize(existing.get()), existing.get().getId());
            return existing.get();
        }

        MaterialSize size = new MaterialSize();
        size.setWidth(request.getWidth());
        size.setThickness(request.getThickness());
        String name = normalizeText(request.getName());
        size.setName(name != null ? name : LegacySizeFormatter.materialSize(size));
        size.setDescription(normalizeText(request.getDescription()));
        MaterialSize saved = materialSizeRepository.save(size);
        logger.info("Added material size ID: {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ProductSizeVariant> getVariantsForProfile(Long profileId) {
        return variantRepository.findByProfileIdOrderByIdAsc(profileId);
    }

    /**
     * The variant flagged default, or the first one when none is flagged.
     */
    @Transactional(readOnly = true)
    public Optional<ProductSizeVariant> getDefaultVariant(Long profileId) {
        List<ProductSizeVariant> variants = variantRepository.findByProfileIdOrderByIdAsc(profileId);
        return variants.stream()
                .filter(ProductSizeVariant::isDefaultVariant)
                .findFirst()
                .or(() -> variants.stream().findFirst());
    }

    @Transactional
    public ProductSizeVariant addVariant(Long profileId, ProductVariantRequest request, Permissions permissions) {
        permissions.requireEdit();
        if (!profileRepository.existsById(profileId)) {
            throw new ResourceNotFoundException("Profile", profileId);
        }
        if (request == null) {
            throw new InventoryValidationException("Product size is required");
        }
        ProductSizeVariant variant = new ProductSizeVariant();
        variant.setProfileId(profileId);
        applyVariant(variant, request, true);
        ProductSizeVariant saved = variantRepository.save(variant);
        if (saved.isDefaultVariant()) {
            clearOtherDefaults(saved);
        }
        logger.info("Added product size {} to profile {}", LegacySizeFormatter.productVariant(saved), profileId);
        return saved;
    }

    @Transactional
    public ProductSizeVariant updateVariant(Long variantId, ProductVariantRequest request, Permissions permissions) {
        permissions.requireEdit();
        ProductSizeVariant variant = variantRepository.findById(variantId)
                .orElseThrow(() -> new ResourceNotFoundException("Product size variant", variantId));
        if (request == null) {
            return variant;
        }
        applyVariant(variant, request, false);
        ProductSizeVariant saved = variantRepository.save(variant);
        if (saved.isDefaultVariant()) {
            clearOtherDefaults(saved);
        }
        logger.info("Updated product size variant {}", variantId);
        return saved;
    }

    @Transactional
    public void deleteVariant(Long variantId, Permissions permissions) {
        permissions.requireEdit();
        ProductSizeVariant variant = variantRepository.findById(variantId)
                .orElseThrow(() -> new ResourceNotFoundException("Product size variant", variantId));
        variantRepository.delete(variant);
        logger.info("Deleted product size variant {} of profile {}", variantId, variant.getProfileId());
    }

    /**
     * Legacy "W × T mm (±tol); ..." string for a profile.
     */
    @Transactional(readOnly = true)
    public String formatVariants(Long profileId) {
        return LegacySizeFormatter.productVariants(variantRepository.findByProfileIdOrderByIdAsc(profileId));
    }

    public MaterialSizeDto toDto(MaterialSize size) {
        MaterialSizeDto dto = new MaterialSizeDto();
        dto.setId(size.getId());
        dto.setWidth(size.getWidth());
        dto.setThickness(size.getThickness());
        dto.setName(size.getName());
        dto.setDescription(size.getDescription());
        dto.setDisplayName(LegacySizeFormatter.materialSize(size));
        return dto;
    }

    public ProductVariantDto toDto(ProductSizeVariant variant) {
        ProductVariantDto dto = new ProductVariantDto();
        dto.setId(variant.getId());
        dto.setProfileId(variant.getProfileId());
        dto.setWidth(variant.getWidth());
        dto.setThickness(variant.getThickness());
        dto.setTolerance(variant.getTolerance());
        dto.setMaterialSizeId(variant.getMaterialSizeId());
        dto.setDefaultVariant(variant.isDefaultVariant());
        dto.setNotes(variant.getNotes());
        dto.setDisplayName(LegacySizeFormatter.productVariant(variant));
        return dto;
    }

    private void applyVariant(ProductSizeVariant variant, ProductVariantRequest request, boolean creating) {
        if (creating || request.getWidth() != null) {
            requirePositive("Width", request.getWidth());
            variant.setWidth(request.getWidth());
        }
        if (request.getThickness() != null) {
            requirePositive("Thickness", request.getThickness());
            variant.setThickness(request.getThickness());
        }
        if (request.getTolerance() != null) {
            if (request.getTolerance() < 0) {
                throw new InventoryValidationException("Tolerance must not be negative");
            }
            variant.setTolerance(request.getTolerance());
        }
        if (request.getMaterialSizeId() != null) {
            if (!materialSizeRepository.existsById(request.getMaterialSizeId())) {
                throw new ResourceNotFoundException("Material size", request.getMaterialSizeId());
            }
            variant.setMaterialSizeId(request.getMaterialSizeId());
        }
        if (request.getDefaultVariant() != null) {
            variant.setDefaultVariant(request.getDefaultVariant());
        }
        if (request.getNotes() != null) {
            variant.setNotes(normalizeText(request.getNotes()));
        }
    }

    private void clearOtherDefaults(ProductSizeVariant keep) {
        for (ProductSizeVariant sibling : variantRepository.findByProfileIdOrderByIdAsc(keep.getProfileId())) {
            if (!sibling.getId().equals(keep.getId()) && sibling.isDefaultVariant()) {
                sibling.setDefaultVariant(false);
                variantRepository.save(sibling);
            }
        }
    }

    private static void requirePositive(String field, Double value) {
        if (value == null || value <= 0) {
            throw new InventoryValidationException(field + " must be greater than 0");
        }
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
