package com.flagship.accounting.depreciation;

import com.flagship.accounting.depreciation.dto.AssetRequest;
import com.flagship.accounting.depreciation.dto.CategoryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetService assetService;

    @PostMapping("/categories")
    public ResponseEntity<AssetCategory> createCategory(@Valid @RequestBody CategoryRequest request) {
        AssetCategory category = assetService.createCategory(
            request.getCode(),
            request.getName(),
            request.getDepreciationMethod(),
            request.getDepreciationRate(),
            request.getUsefulLifeYears(),
            request.getAssetAccountId(),
            request.getAccumulatedDepreciationAccountId(),
            request.getDepreciationExpenseAccountId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(category);
    }

    @GetMapping("/categories")
    public List<AssetCategory> listCategories() {
        return assetService.listCategories();
    }

    @PostMapping
    public ResponseEntity<FixedAsset> registerAsset(@Valid @RequestBody AssetRequest request) {
        FixedAsset asset = assetService.registerAsset(
            request.getAssetCode(),
            request.getName(),
            request.getCategoryId(),
            request.getAcquisitionDate(),
            request.getCapitalizedValue(),
            request.getDepreciationMethod(),
            request.getDepreciationRate(),
            request.getSalvageValue()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(asset);
    }

    @GetMapping
    public List<FixedAsset> listAssets(@RequestParam(value = "status", required = false) AssetStatus status,
                                       @RequestParam(value = "categoryId", required = false) UUID categoryId) {
        return assetService.listAssets(status, categoryId);
    }

    @GetMapping("/{id}")
    public FixedAsset getAsset(@PathVariable("id") UUID id) {
        return assetService.findById(id);
    }

    @PostMapping("/{id}/status")
    public FixedAsset changeStatus(@PathVariable("id") UUID id, @RequestParam("status") AssetStatus status) {
        return assetService.changeStatus(id, status);
    }

    @GetMapping("/{id}/schedule")
    public List<DepreciationEntry> schedule(@PathVariable("id") UUID id) {
        return assetService.schedule(id);
    }
}
