package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Definitions of every {@link KpiKey}, used to explain a figure next to its
 * value.
 *
 * @since 1.0.0
 */
public final class KpiFormulaCatalog {

    private static final Map<KpiKey, KpiFormula> FORMULAS = new EnumMap<>(KpiKey.class);

    static {
        // ratios
        quotient(KpiKey.LOSS_RATIO, "满期赔付率", "(已报告赔款 / 满期保费) × 100%",
                "每100元满期保费对应的赔款支出", "已报告赔款（元）", "满期保费（元）", "%",
                "反映业务的风险成本，赔付率越低盈利能力越强", "赔款500万元 ÷ 满期保费1000万元 = 50%");
        quotient(KpiKey.EXPENSE_RATIO, "费用率", "(费用金额 / 签单保费) × 100%",
                "每100元签单保费对应的费用支出", "费用金额（元）", "签单保费（元）", "%",
                "反映业务的运营效率，费用率越低管理越精细", "费用300万元 ÷ 签单保费1000万元 = 30%");
        quotient(KpiKey.MATURITY_RATIO, "满期率", "(满期保费 / 签单保费) × 100%",
                "签单保费中已满期部分的占比", "满期保费（元）", "签单保费（元）", "%",
                "反映保单的成熟度，满期率越高保单越接近全年覆盖", "满期保费800万元 ÷ 签单保费1000万元 = 80%");
        quotient(KpiKey.CONTRIBUTION_MARGIN_RATIO, "满期边际贡献率", "(边际贡献额 / 满期保费) × 100%",
                "每100元满期保费贡献的边际利润", "边际贡献额（元）", "满期保费（元）", "%",
                "反映业务的盈利能力，贡献率越高盈利越好", "边际贡献200万元 ÷ 满期保费1000万元 = 20%");
        plain(KpiKey.VARIABLE_COST_RATIO, "变动成本率", "费用率 + 满期赔付率",
                "包含费用与赔款的综合成本率，缺失的一项按0计", "%",
                "反映业务的综合成本水平，成本率越低越好", "费用率30% + 赔付率50% = 80%");
        quotient(KpiKey.MATURED_CLAIM_RATIO, "满期出险率", "(赔案件数 / 保单件数) × 满期率",
                "按满期程度折算的出险率", "赔案件数", "保单件数", "%",
                "反映客户的出险频率，出险率越低客户质量越好", "(500件 ÷ 10000件) × 80% = 4%");
        quotient(KpiKey.AUTONOMY_COEFFICIENT, "商业险自主系数", "签单保费 / 商业险折前保费",
                "实际签单保费与折前保费的比值", "签单保费（元）", "商业险折前保费（元）", "",
                "反映定价自主性和折扣力度，系数越接近1折扣越少", "签单800万元 ÷ 折前1000万元 = 0.80");
        quotient(KpiKey.PREMIUM_PROGRESS, "保费时间进度达成率", "(签单保费 / 保费计划) / 时间进度 × 100%",
                "按时间进度折算的保费计划完成情况", "签单保费（元）", "保费计划（元） × 时间进度", "%",
                "反映保费进度是否符合预期，超过100%表示快于时间进度",
                "(签单500万元 ÷ 计划1000万元) ÷ (182天 ÷ 365天) = 100.3%");
        quotient(KpiKey.POLICY_COUNT_PROGRESS, "件数时间进度达成率", "(保单件数 / 年度件数目标) / 时间进度 × 100%",
                "按时间进度折算的件数目标完成情况", "保单件数", "年度件数目标 × 时间进度", "%",
                "反映业务量进度是否符合预期，超过100%表示快于时间进度",
                "(6000件 ÷ 10000件) ÷ 50% = 120%");

        // absolutes
        plain(KpiKey.SIGNED_PREMIUM, "签单保费", "Σ 签单保费（元） / 10000",
                "全部保单的签单保费合计", "万元", "反映业务规模，是最核心的业务量指标", "1000万元");
        plain(KpiKey.MATURED_PREMIUM, "满期保费", "Σ 满期保费（元） / 10000",
                "已满期部分的保费合计", "万元", "反映已经赚取的保费规模", "800万元");
        plain(KpiKey.POLICY_COUNT, "保单件数", "Σ 保单件数",
                "保单总数", "件", "反映业务量的数量维度", "10,000件");
        plain(KpiKey.CLAIM_CASE_COUNT, "赔案件数", "Σ 赔案件数",
                "发生理赔的案件总数", "件", "反映出险频率的绝对数量", "500件");
        plain(KpiKey.REPORTED_CLAIM_PAYMENT, "已报告赔款", "Σ 已报告赔款（元） / 10000",
                "已报告赔款合计", "万元", "反映赔款成本的绝对规模", "500万元");
        plain(KpiKey.EXPENSE_AMOUNT, "费用金额", "Σ 费用金额（元） / 10000",
                "业务费用合计", "万元", "反映运营成本的绝对规模", "300万元");
        plain(KpiKey.CONTRIBUTION_MARGIN_AMOUNT, "边际贡献额", "Σ 边际贡献额（元） / 10000",
                "边际利润合计，可为负", "万元", "反映盈利能力的绝对金额", "200万元");

        // targets
        plain(KpiKey.ANNUAL_PREMIUM_TARGET, "年度保费计划", "年度保费目标（元） / 10000，未指定时为 Σ 保费计划（元） / 10000",
                "计算保费达成率所用的年度计划", "万元", "保费时间进度达成率的比较基准", "2000万元");
        plain(KpiKey.ANNUAL_POLICY_COUNT_TARGET, "年度件数目标", "调用方指定的年度件数目标",
                "计算件数达成率所用的年度目标", "件", "件数时间进度达成率的比较基准", "20,000件");

        // averages
        quotient(KpiKey.AVERAGE_PREMIUM, "件均保费", "签单保费（元） / 保单件数",
                "每张保单的平均保费", "签单保费（元）", "保单件数", "元",
                "反映单均业务价值", "1000万元 ÷ 10000件 = 1000元");
        quotient(KpiKey.AVERAGE_CLAIM, "案均赔款", "已报告赔款（元） / 赔案件数",
                "每个赔案的平均赔款", "已报告赔款（元）", "赔案件数", "元",
                "反映案件严重程度，案均赔款越高风险越大", "500万元 ÷ 500件 = 10000元");
        quotient(KpiKey.AVERAGE_EXPENSE, "件均费用", "费用金额（元） / 保单件数",
                "每张保单的平均费用", "费用金额（元）", "保单件数", "元",
                "反映单均运营成本，件均费用越低效率越高", "300万元 ÷ 10000件 = 300元");
        quotient(KpiKey.AVERAGE_CONTRIBUTION, "单均边贡额", "边际贡献额（元） / 保单件数",
                "每张保单的平均边际贡献", "边际贡献额（元）", "保单件数", "元",
                "反映单均盈利水平", "200万元 ÷ 10000件 = 200元");
    }

    private KpiFormulaCatalog() {
        // utility class
    }

    /**
     * @param key metric key; must not be {@code null}
     * @return the definition; every key has one
     */
    public static KpiFormula get(KpiKey key) {
        Objects.requireNonNull(key, "KPI key must not be null");
        return FORMULAS.get(key);
    }

    /**
     * @return every definition in {@link KpiKey} declaration order
     */
    public static List<KpiFormula> all() {
        return List.copyOf(FORMULAS.values());
    }

    /**
     * @return unmodifiable view keyed by metric
     */
    public static Map<KpiKey, KpiFormula> asMap() {
        return Collections.unmodifiableMap(FORMULAS);
    }

    /**
     * Render the inputs of one calculation, e.g.
     *
     * <pre>
     * 已报告赔款（元）: 5,000,000
     * 满期保费（元）: 10,000,000
     * 结果 = 50%
     * </pre>
     *
     * Metrics that are not a quotient render as their formula. Missing values
     * render as {@code -}.
     *
     * @return multi-line detail text
     */
    public static String formatCalculationDetail(KpiKey key, Double numerator, Double denominator, Double result) {
        KpiFormula formula = get(key);
        if (formula.getNumerator().isEmpty() || formula.getDenominator().isEmpty()) {
            return formula.getFormula();
        }
        return formula.getNumerator().get() + ": " + format(numerator) + "\n"
                + formula.getDenominator().get() + ": " + format(denominator) + "\n"
                + "结果 = " + format(result) + formula.getUnit();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void quotient(KpiKey key, String name, String formula, String description, String numerator,
            String denominator, String unit, String meaning, String example) {
        FORMULAS.put(key, new KpiFormula(key, name, formula, description, numerator, denominator, unit, meaning,
                example));
    }

    private static void plain(KpiKey key, String name, String formula, String description, String unit,
            String meaning, String example) {
        FORMULAS.put(key, new KpiFormula(key, name, formula, description, null, null, unit, meaning, example));
    }

    private static String format(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return "-";
        }
        // DecimalFormat is not thread-safe
        DecimalFormat format = new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(value);
    }
}
