package com.pshcalculator.service;

import com.pshcalculator.exception.ValidationException;
import com.pshcalculator.model.AuditInfo;
import com.pshcalculator.model.CalculationRequest;
import com.pshcalculator.model.FamilyComposition;
import com.pshcalculator.model.FinancialInput;
import com.pshcalculator.model.FmrRateTable;
import com.pshcalculator.model.HouseholdInput;
import com.pshcalculator.model.Money;
import com.pshcalculator.model.ValidatedRequest;
import com.pshcalculator.model.ValidationError;
import com.pshcalculator.model.ValidationErrorCode;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks calculation input before it reaches the calculator.
 *
 * Every field is checked and every violation is reported, so a form can
 * highlight all bad fields at once. A TTP below the $50 minimum is not an
 * error here; the calculator raises it to the floor.
 */
@Service
public class InputValidator {

    /**
     * Collect all validation errors for a request.
     *
     * @param request raw input, any part of which may be null
     * @return the errors found, empty when the request is valid
     */
    public List<ValidationError> check(CalculationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        if (request == null) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, "request", "Calculation input is required"));
            return errors;
        }
        checkHousehold(request.household(), errors);
        checkFinancial(request.financial(), errors);
        checkFamily(request.family(), errors);
        return errors;
    }

    /**
     * Validate and normalize a request.
     *
     * @throws ValidationException carrying every violation, if any
     */
    public ValidatedRequest validate(CalculationRequest request) {
        List<ValidationError> errors = check(request);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        HouseholdInput household = request.household();
        FinancialInput financial = request.financial();
        return new ValidatedRequest(
            new HouseholdInput(
                household.headOfHouseholdName().trim(),
                household.voucherBedroomSize(),
                household.unitBedrooms()
            ),
            new FinancialInput(
                Money.normalize(financial.rentToOwner()),
                Money.normalize(financial.utilityAllowance()),
                Money.normalize(financial.totalTenantPayment())
            ),
            request.family(),
            normalizeAudit(request.audit())
        );
    }

    /**
     * Trim the sign-off names and default the calculation date to today.
     */
    static AuditInfo normalizeAudit(AuditInfo audit) {
        if (audit == null) {
            return new AuditInfo(null, LocalDate.now(), null, null);
        }
        return new AuditInfo(
            blankToNull(audit.haStaff()),
            audit.calculationDate() != null ? audit.calculationDate() : LocalDate.now(),
            blankToNull(audit.supervisorName()),
            audit.supervisorDate()
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private void checkHousehold(HouseholdInput household, List<ValidationError> errors) {
        if (household == null) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, "household", "Household information is required"));
            return;
        }
        String name = household.headOfHouseholdName();
        if (name == null || name.isBlank()) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, "household.headOfHouseholdName",
                "Head of household name is required"));
        }
        checkBedrooms(household.voucherBedroomSize(), "household.voucherBedroomSize", "Voucher bedroom size", errors);
        checkBedrooms(household.unitBedrooms(), "household.unitBedrooms", "Bedrooms in unit", errors);
    }

    private void checkBedrooms(Integer size, String field, String label, List<ValidationError> errors) {
        if (size == null) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, field, label + " is required"));
        } else if (!FmrRateTable.isValidBedroomSize(size)) {
            errors.add(error(ValidationErrorCode.OUT_OF_RANGE, field,
                label + " must be between " + FmrRateTable.MIN_BEDROOMS + " and " + FmrRateTable.MAX_BEDROOMS));
        }
    }

    private void checkFinancial(FinancialInput financial, List<ValidationError> errors) {
        if (financial == null) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, "financial", "Financial information is required"));
            return;
        }

        BigDecimal rent = financial.rentToOwner();
        if (checkAmount(rent, "financial.rentToOwner", "Rent to owner", errors) && rent.signum() <= 0) {
            errors.add(error(ValidationErrorCode.INVALID_AMOUNT, "financial.rentToOwner",
                "Rent to owner must be greater than $0"));
        }

        BigDecimal utility = financial.utilityAllowance();
        if (checkAmount(utility, "financial.utilityAllowance", "Utility allowance", errors) && utility.signum() < 0) {
            errors.add(error(ValidationErrorCode.INVALID_AMOUNT, "financial.utilityAllowance",
                "Utility allowance cannot be negative"));
        }

        BigDecimal ttp = financial.totalTenantPayment();
        if (checkAmount(ttp, "financial.totalTenantPayment", "Total tenant payment", errors) && ttp.signum() < 0) {
            errors.add(error(ValidationErrorCode.INVALID_AMOUNT, "financial.totalTenantPayment",
                "Total tenant payment cannot be negative"));
        }
    }

    /**
     * @return true if the amount is present and in whole cents, so range checks can follow
     */
    private boolean checkAmount(BigDecimal amount, String field, String label, List<ValidationError> errors) {
        if (amount == null) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, field, label + " is required"));
            return false;
        }
        if (!Money.hasWholeCents(amount)) {
            errors.add(error(ValidationErrorCode.INVALID_AMOUNT, field,
                label + " cannot have more than two decimal places"));
            return false;
        }
        return true;
    }

    private void checkFamily(FamilyComposition family, List<ValidationError> errors) {
        if (family == null) {
            errors.add(error(ValidationErrorCode.MISSING_FIELD, "family", "Family composition is required"));
            return;
        }
        boolean eligibleOk = checkMemberCount(family.eligibleMembers(), "family.eligibleMembers",
            "Eligible members", errors);
        boolean ineligibleOk = checkMemberCount(family.ineligibleMembers(), "family.ineligibleMembers",
            "Ineligible members", errors);

        if (eligibleOk && ineligibleOk && family.totalMembers() == 0) {
            errors.add(error(ValidationErrorCode.INVALID_FAMILY_COMPOSITION, "family",
                "Household must have at least one member"));
        }
    }

    private boolean checkMemberCount(Integer count, String field, String label, List<ValidationError> errors) {
        if (count == null) {
            errors.add(error(ValidationErrorCode.INVALID_FAMILY_COMPOSITION, field, label + " is required"));
            return false;
        }
        if (count < 0) {
            errors.add(error(ValidationErrorCode.INVALID_FAMILY_COMPOSITION, field, label + " cannot be negative"));
            return false;
        }
        return true;
    }

    private static ValidationError error(ValidationErrorCode code, String field, String message) {
        return new ValidationError(code, field, message);
    }
}
