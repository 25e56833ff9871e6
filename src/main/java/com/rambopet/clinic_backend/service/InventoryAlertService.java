package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.config.NotificationProperties;
import com.rambopet.clinic_backend.dto.response.InventoryValuation;
import com.rambopet.clinic_backend.dto.response.JobRunSummary;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.model.Lot;
import com.rambopet.clinic_backend.model.Product;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.LotRepository;
import com.rambopet.clinic_backend.repository.ProductRepository;
import com.rambopet.clinic_backend.repository.UserRepository;
import com.rambopet.clinic_backend.util.Constants;
import com.rambopet.clinic_backend.util.DateUtil;
import com.rambopet.clinic_backend.util.ReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryAlertService {

    public static final String LOW_STOCK_JOB = "low-stock-alert";
    public static final String EXPIRY_JOB = "expiry-alert";
    public static final String VALUATION_JOB = "inventory-valuation";

    private static final Set<Role> LOW_STOCK_RECIPIENTS = EnumSet.of(Role.ADMIN, Role.RECEPTIONIST);
    private static final Set<Role> EXPIRY_RECIPIENTS = EnumSet.of(Role.ADMIN, Role.VETERINARIAN, Role.RECEPTIONIST);
    private static final Set<Role> VALUATION_RECIPIENTS = EnumSet.of(Role.ADMIN);
    private static final DateTimeFormatter MONTH_FORMATTER = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private final ProductRepository productRepository;
    private final LotRepository lotRepository;
    private final UserRepository userRepository;
    private final EmailService emailService;
    private final ClinicProperties clinicProperties;
    private final NotificationProperties notificationProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JobRunSummary checkStockLevels() {
        JobRunSummary summary = JobRunSummary.start(LOW_STOCK_JOB, LocalDateTime.now(clock));

        String body = transactionTemplate.execute(status -> {
            List<Product> lowStock = productRepository.findLowStockProducts();
            summary.setCandidates(lowStock.size());
            if (lowStock.isEmpty()) {
                return null;
            }
            String lines = lowStock.stream()
                    .map(p -> "- " + p.getCode() + " - " + p.getName() + " (" + p.getCategory() + "): " +
                            "current stock " + p.getTotalStock() + ", minimum " + p.getMinStock())
                    .collect(Collectors.joining("\n"));
            return "Low stock alert at " + clinicProperties.getName() + "\n\n" +
                    "The following products are below their minimum stock:\n\n" +
                    lines + "\n\n" +
                    "Please review the inventory and consider placing an order.";
        });

        if (body != null) {
            summary.setProcessed(summary.getCandidates());
            sendToRecipients(LOW_STOCK_RECIPIENTS,
                    "Low stock alert - " + summary.getCandidates() + " product(s)", body, summary);
        }

        log.info("Low stock check: {} products below minimum, {} emails sent, {} failed",
                summary.getCandidates(), summary.getEmailsSent(), summary.getFailures());
        return summary;
    }

    /**
     * Alerts staff about expired lots with stock and lots expiring within the window.
     * Lots are stamped with the alert date once at least one email went out, so a second run on the
     * same day finds nothing to send.
     */
    public JobRunSummary checkExpiringLots() {
        LocalDate today = LocalDate.now(clock);
        JobRunSummary summary = JobRunSummary.start(EXPIRY_JOB, LocalDateTime.now(clock));
        LocalDate limit = today.plusDays(notificationProperties.getExpiryWindowDays());

        List<UUID> lotIds = new ArrayList<>();
        String body = transactionTemplate.execute(status -> {
            List<Lot> pending = lotRepository.findPendingExpiryAlerts(today, limit);
            summary.setCandidates(pending.size());
            if (pending.isEmpty()) {
                return null;
            }
            pending.forEach(lot -> lotIds.add(lot.getId()));
            return buildExpiryMessage(pending, today);
        });

        if (body != null) {
            sendToRecipients(EXPIRY_RECIPIENTS, "Expiry alert - " + clinicProperties.getName(), body, summary);
            if (summary.getEmailsSent() > 0) {
                transactionTemplate.executeWithoutResult(status -> lotRepository.findAllById(lotIds).forEach(lot -> {
                    lot.setLastExpiryAlertDate(today);
                    lotRepository.save(lot);
                }));
                summary.setProcessed(lotIds.size());
            }
        }

        log.info("Expiry check: {} lots pending alert, {} emails sent, {} failed",
                summary.getCandidates(), summary.getEmailsSent(), summary.getFailures());
        return summary;
    }

    public JobRunSummary sendMonthlyValuation() {
        LocalDate today = LocalDate.now(clock);
        JobRunSummary summary = JobRunSummary.start(VALUATION_JOB, LocalDateTime.now(clock));

        InventoryValuation valuation = transactionTemplate.execute(status -> calculateValuation(today));
        summary.setCandidates(valuation.getLines().size());
        summary.setProcessed(valuation.getLines().size());

        byte[] workbook = ReportGenerator.generateInventoryValuationExcel(valuation);
        String filename = "inventory-valuation-" + today + ".xlsx";
        String body = "Monthly inventory report - " + today.format(MONTH_FORMATTER) + "\n\n" +
                "Active products: " + valuation.getLines().size() + "\n" +
                "Estimated inventory value: " + Constants.CURRENCY_CODE + " " + valuation.getTotalValue() + "\n\n" +
                "The attached spreadsheet lists the value per product.\n\n" +
                clinicProperties.getName() + " system";

        for (String email : recipientEmails(VALUATION_RECIPIENTS)) {
            try {
                emailService.sendEmailWithAttachment(email, "Monthly inventory report - " + clinicProperties.getName(),
                        body, filename, workbook, ReportGenerator.XLSX_CONTENT_TYPE);
                summary.incrementEmailsSent();
            } catch (Exception e) {
                summary.incrementFailures();
                log.error("Error sending inventory report to {}: {}", email, e.getMessage(), e);
            }
        }

        log.info("Inventory valuation: {} products, total {}, {} emails sent",
                valuation.getLines().size(), valuation.getTotalValue(), summary.getEmailsSent());
        return summary;
    }

    /**
     * Stock times purchase price for every active product.
     */
    public InventoryValuation calculateValuation(LocalDate asOf) {
        List<InventoryValuation.Line> lines = productRepository.findByActiveTrueOrderByNameAsc()
                .stream()
                .map(product -> {
                    BigDecimal price = product.getPurchasePrice() != null ? product.getPurchasePrice() : BigDecimal.ZERO;
                    int stock = product.getTotalStock();
                    return InventoryValuation.Line.builder()
                            .code(product.getCode())
                            .name(product.getName())
                            .totalStock(stock)
                            .purchasePrice(price)
                            .value(price.multiply(BigDecimal.valueOf(stock)))
                            .build();
                })
                .collect(Collectors.toList());

        BigDecimal total = lines.stream()
                .map(InventoryValuation.Line::getValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return InventoryValuation.builder()
                .asOf(asOf)
                .totalValue(total)
                .lines(lines)
                .build();
    }

    private void sendToRecipients(Set<Role> roles, String subject, String body, JobRunSummary summary) {
        List<String> recipients = recipientEmails(roles);
        if (recipients.isEmpty()) {
            log.warn("No active recipients with roles {} for '{}'", roles, subject);
            return;
        }
        for (String email : recipients) {
            try {
                emailService.sendEmail(email, subject, body);
                summary.incrementEmailsSent();
            } catch (Exception e) {
                summary.incrementFailures();
                log.error("Error sending '{}' to {}: {}", subject, email, e.getMessage(), e);
            }
        }
    }

    private List<String> recipientEmails(Set<Role> roles) {
        return userRepository.findByRoleInAndActiveTrue(roles)
                .stream()
                .map(User::getEmail)
                .distinct()
                .collect(Collectors.toList());
    }

    private String buildExpiryMessage(List<Lot> lots, LocalDate today) {
        List<Lot> expired = lots.stream().filter(lot -> lot.isExpired(today)).collect(Collectors.toList());
        List<Lot> expiring = lots.stream().filter(lot -> !lot.isExpired(today)).collect(Collectors.toList());

        StringBuilder message = new StringBuilder("Expiry alert at ").append(clinicProperties.getName()).append("\n");
        if (!expired.isEmpty()) {
            message.append("\nEXPIRED LOTS WITH STOCK (").append(expired.size()).append("):\n");
            expired.forEach(lot -> message.append("- ").append(describeLot(lot))
                    .append(": expired on ").append(DateUtil.formatDate(lot.getExpiryDate()))
                    .append(" - stock ").append(lot.getCurrentStock()).append("\n"));
            message.append("These products must be withdrawn from inventory immediately.\n");
        }
        if (!expiring.isEmpty()) {
            message.append("\nLOTS EXPIRING SOON (").append(expiring.size()).append("):\n");
            expiring.forEach(lot -> message.append("- ").append(describeLot(lot))
                    .append(": expires on ").append(DateUtil.formatDate(lot.getExpiryDate()))
                    .append(" (").append(lot.daysToExpiry(today)).append(" days)")
                    .append(" - stock ").append(lot.getCurrentStock()).append("\n"));
            message.append("Use these products first or consider a return or discount.\n");
        }
        return message.toString();
    }

    private String describeLot(Lot lot) {
        return lot.getProduct().getCode() + " - " + lot.getProduct().getName() + " (lot " + lot.getLotNumber() + ")";
    }
}
