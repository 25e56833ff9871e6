package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.dto.request.ProductRequest;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.ProductResponse;
import com.rambopet.clinic_backend.dto.response.StockMovementResponse;
import com.rambopet.clinic_backend.dto.response.StockReportItem;
import com.rambopet.clinic_backend.enums.ProductCategory;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.repository.ProductRepository;
import com.rambopet.clinic_backend.repository.StockMovementRepository;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private final ProductRepository productRepository;
    private final StockMovementRepository stockMovementRepository;
    private final StockService stockService;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public PaginatedResponse<ProductResponse> getAllProducts(int page, int limit, String search,
                                                            ProductCategory category, Boolean active,
                                                            Boolean prescriptionRequired) {
        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by("name").ascending());
        Page<Product> products = productRepository.searchProducts(search, category, active, prescriptionRequired, pageable);

        List<ProductResponse> responses = products.getContent()
                .stream()
                .map(this::mapToProductResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, products.getTotalElements());
    }

    @Transactional(readOnly = true)
    public ProductResponse getProductById(UUID id) {
        return mapToProductResponse(findProduct(id));
    }

    @Transactional
    public ProductResponse createProduct(ProductRequest request) {
        String code = request.getCode().trim().toUpperCase();
        if (productRepository.existsByCodeIgnoreCase(code)) {
            throw ValidationException.of("product", "code", "Product code already exists");
        }

        Product product = new Product();
        modelMapper.map(request, product);
        product.setCode(code);

        Product saved = productRepository.save(product);
        log.info("Product created: {} ({})", saved.getName(), saved.getCode());
        return mapToProductResponse(saved);
    }

    @Transactional
    public ProductResponse updateProduct(UUID id, ProductRequest request) {
        Product product = findProduct(id);
        String code = request.getCode().trim().toUpperCase();
        if (productRepository.existsByCodeIgnoreCaseAndIdNot(code, id)) {
            throw ValidationException.of("product", "code", "Product code already exists");
        }

        modelMapper.map(request, product);
        product.setCode(code);
        if (product.getMaxStock() < product.getMinStock()) {
            throw ValidationException.of("product", "maxStock", "Maximum stock must be greater than or equal to minimum stock");
        }

        log.info("Product updated: {}", id);
        return mapToProductResponse(productRepository.save(product));
    }

    @Transactional
    public void deactivateProduct(UUID id) {
        Product product = findProduct(id);
        product.setActive(false);
        productRepository.save(product);
        log.info("Product deactivated: {}", id);
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> getLowStockProducts() {
        return findLowStockProducts()
                .stream()
                .map(this::mapToProductResponse)
                .collect(Collectors.toList());
    }

    public List<Product> findLowStockProducts() {
        return productRepository.findLowStockProducts();
    }

    /**
     * Stock position of every active product.
     */
    @Transactional(readOnly = true)
    public List<StockReportItem> getStockReport() {
        return productRepository.findByActiveTrueOrderByNameAsc()
                .stream()
                .map(product -> StockReportItem.builder()
                        .productId(product.getId())
                        .code(product.getCode())
                        .name(product.getName())
                        .totalStock(product.getTotalStock())
                        .minStock(product.getMinStock())
                        .maxStock(product.getMaxStock())
                        .status(product.getStockLevelStatus())
                        .activeLots(product.getActiveLotCount())
                        .build())
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<StockMovementResponse> getMovementHistory(UUID productId, int limit) {
        Product product = findProduct(productId);
        return stockMovementRepository.findByProductId(product.getId(), PaginationUtil.firstPage(limit))
                .stream()
                .map(stockService::mapToStockMovementResponse)
                .collect(Collectors.toList());
    }

    public Product findProduct(UUID id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product", "id", id));
    }

    public ProductResponse mapToProductResponse(Product product) {
        if (product == null) return null;

        int totalStock = product.getTotalStock();
        return ProductResponse.builder()
                .id(product.getId())
                .code(product.getCode())
                .name(product.getName())
                .description(product.getDescription())
                .category(product.getCategory())
                .activeIngredient(product.getActiveIngredient())
                .concentration(product.getConcentration())
                .manufacturer(product.getManufacturer())
                .unit(product.getUnit())
                .minStock(product.getMinStock())
                .maxStock(product.getMaxStock())
                .purchasePrice(product.getPurchasePrice())
                .salePrice(product.getSalePrice())
                .prescriptionRequired(product.isPrescriptionRequired())
                .lotTracked(product.isLotTracked())
                .active(product.isActive())
                .totalStock(totalStock)
                .lowStock(totalStock < product.getMinStock())
                .stockStatus(product.getStockLevelStatus())
                .createdAt(product.getCreatedAt())
                .updatedAt(product.getUpdatedAt())
                .build();
    }
}
