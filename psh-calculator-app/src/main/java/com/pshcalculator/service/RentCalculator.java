package com.pshcalculator.service;

import com.pshcalculator.model.CalculationResult;
import com.pshcalculator.model.FamilyComposition;
import com.pshcalculator.model.FinancialInput;
import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import com.pshcalculator.model.Money;
import com.pshcalculator.model.ValidatedRequest;
import com.pshcalculator.model.Warning;
import com.pshcalculator.model.WarningSeverity;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PSH rent worksheet: gross rent, HAP, tenant rent and utility reimbursement,
 * with mixed-family proration and the FMR compliance check.
 *
 * Pure function of its inputs. Arithmetic is exact; the only rounding is
 * the prorated HAP (half-up to the cent).
 */
@Service
public class RentCalculator {

    public static final BigDecimal MINIMUM_TTP = Money.of(50);

    private static final int PERCENTAGE_SCALE = 4;

    private final RateResolver rateResolver;

    public RentCalculator(RateResolver rateResolver) {
        this.rateResolver = rateResolver;
    }

    public CalculationResult calculate(ValidatedRequest request, FmrRateTable rateTable) {
        FinancialInput financial = request.financial();
        FamilyComposition family = request.family();
        int bedroomSize = request.household().applicableBedroomSize();
        FmrRate rate = rateResolver.resolve(rateTable, bedroomSize);

        BigDecimal rentToOwner = financial.rentToOwner();
        BigDecimal utilityAllowance = financial.utilityAllowance();
        BigDecimal enteredTtp = financial.totalTenantPayment();

        BigDecimal grossRent = rentToOwner.add(utilityAllowance);
        boolean ttpFloored = enteredTtp.compareTo(MINIMUM_TTP) < 0;
        BigDecimal effectiveTtp = ttpFloored ? MINIMUM_TTP : enteredTtp;
        BigDecimal totalHap = grossRent.subtract(effectiveTtp);

        BigDecimal hapToOwner;
        BigDecimal tenantRent;
        BigDecimal utilityReimbursement;
        if (totalHap.signum() < 0) {
            // TTP exceeds gross rent: the excess comes back as a utility reimbursement
            hapToOwner = Money.ZERO;
            tenantRent = grossRent;
            utilityReimbursement = effectiveTtp.subtract(grossRent).max(Money.ZERO).min(utilityAllowance);
        } else {
            hapToOwner = totalHap;
            tenantRent = effectiveTtp;
            utilityReimbursement = Money.ZERO;
        }

        boolean mixedFamily = family.isMixedFamily();
        BigDecimal proratedHap = null;
        BigDecimal prorationPercentage = null;
        BigDecimal mixedFamilyTenantRent = null;
        if (mixedFamily) {
            BigDecimal eligible = BigDecimal.valueOf(family.eligibleMembers());
            BigDecimal total = BigDecimal.valueOf(family.totalMembers());
            prorationPercentage = eligible.divide(total, PERCENTAGE_SCALE, RoundingMode.HALF_UP);
            proratedHap = hapToOwner.multiply(eligible).divide(total, Money.SCALE, RoundingMode.HALF_UP);
            // HAP can exceed the contract rent when the utility allowance is large
            mixedFamilyTenantRent = rentToOwner.subtract(proratedHap).max(Money.ZERO);
        }

        BigDecimal fmr = rate.fmr();
        boolean exceedsFmr = grossRent.compareTo(fmr) > 0;
        BigDecimal amountAboveFmr = grossRent.subtract(fmr).max(Money.ZERO);

        List<Warning> warnings = new ArrayList<>();
        if (exceedsFmr) {
            warnings.add(new Warning(WarningSeverity.BLOCKING, String.format(Locale.US,
                "Gross rent %s exceeds the %d-bedroom FMR of %s by %s. Supervisor approval required.",
                currency(grossRent), bedroomSize, currency(fmr), currency(amountAboveFmr))));
        }
        if (mixedFamily) {
            warnings.add(new Warning(WarningSeverity.CAUTION, String.format(Locale.US,
                "Mixed family: assistance prorated to %s (%d of %d members eligible). Prorated HAP %s.",
                percent(prorationPercentage), family.eligibleMembers(), family.totalMembers(),
                currency(proratedHap))));
        }
        if (ttpFloored) {
            warnings.add(new Warning(WarningSeverity.INFO, String.format(Locale.US,
                "TTP floored to $50 minimum (entered %s).", currency(enteredTtp))));
        }

        return new CalculationResult(
            grossRent,
            effectiveTtp,
            totalHap,
            hapToOwner,
            tenantRent,
            utilityReimbursement,
            proratedHap,
            prorationPercentage,
            mixedFamilyTenantRent,
            bedroomSize,
            fmr,
            rate.paymentStandard(),
            amountAboveFmr,
            exceedsFmr,
            mixedFamily,
            ttpFloored,
            rateTable.effectiveDate(),
            warnings,
            request.audit()
        );
    }

    static String currency(BigDecimal amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
