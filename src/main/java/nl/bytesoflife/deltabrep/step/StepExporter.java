package nl.bytesoflife.deltabrep.step;

import nl.bytesoflife.deltabrep.geometry.BoundingBox;
import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static nl.bytesoflife.deltabrep.step.StepEntityWriter.bool;
import static nl.bytesoflife.deltabrep.step.StepEntityWriter.escape;
import static nl.bytesoflife.deltabrep.step.StepEntityWriter.list;
import static nl.bytesoflife.deltabrep.step.StepEntityWriter.point;
import static nl.bytesoflife.deltabrep.step.StepEntityWriter.real;
import static nl.bytesoflife.deltabrep.step.StepEntityWriter.real3;

/**
 * Writes a {@link CrateDesign} as a STEP AP242 (ISO-10303-21) assembly in inches.
 * <p>
 * Every part becomes a box-shaped MANIFOLD_SOLID_BREP with its own product chain,
 * placed at its minimum corner and wired into one root assembly product. Parts are
 * emitted in ascending id order and the header carries a fixed timestamp, so the
 * same design always produces the same text. Parts with a dimension of
 * {@value #MIN_PART_DIMENSION} inch or less are skipped.
 */
public final class StepExporter {

    private static final Logger log = LoggerFactory.getLogger(StepExporter.class);

    public static final double MIN_PART_DIMENSION = 1e-6;
    public static final double MILLIMETRES_PER_INCH = 25.4;

    static final String FIXED_TIMESTAMP = "1970-01-01T00:00:00Z";
    static final String SCHEMA = "AP242_MANAGED_MODEL_BASED_3D_ENGINEERING_MIM_LATEST";

    private static final String DIR_X_POS = "(1.0,0.0,0.0)";
    private static final String DIR_Y_POS = "(0.0,1.0,0.0)";
    private static final String DIR_Z_POS = "(0.0,0.0,1.0)";
    private static final String DIR_X_NEG = "(-1.0,0.0,0.0)";
    private static final String DIR_Y_NEG = "(0.0,-1.0,0.0)";
    private static final String DIR_Z_NEG = "(0.0,0.0,-1.0)";

    private final CrateDesign design;
    private final StepExportOptions options;
    private final StepEntityWriter out = new StepEntityWriter();

    private StepExporter(CrateDesign design, StepExportOptions options) {
        this.design = Objects.requireNonNull(design, "design");
        this.options = Objects.requireNonNull(options, "options");
    }

    public static String exportStepAp242(CrateDesign design) {
        return exportStepAp242(design, StepExportOptions.defaults());
    }

    public static String exportStepAp242(CrateDesign design, StepExportOptions options) {
        return new StepExporter(design, options).generate();
    }

    /**
     * Exports the design and writes it to {@code path} as UTF-8.
     */
    public static void write(CrateDesign design, StepExportOptions options, Path path) throws IOException {
        String content = exportStepAp242(design, options);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        log.info("Wrote STEP assembly '{}' to {} ({} chars)", options.getProductName(), path, content.length());
    }

    static boolean isDegenerate(BoundingBox bounds) {
        if (bounds.isEmpty() || !isFinite(bounds.getMin()) || !isFinite(bounds.getMax())) return true;
        Vector3 size = bounds.size();
        return !(size.x() > MIN_PART_DIMENSION && size.y() > MIN_PART_DIMENSION && size.z() > MIN_PART_DIMENSION);
    }

    private static boolean isFinite(Point3 p) {
        return Double.isFinite(p.x()) && Double.isFinite(p.y()) && Double.isFinite(p.z());
    }

    private String generate() {
        Contexts ctx = createContexts(options.getProductName());

        List<CratePart> parts = new ArrayList<>(design.getParts());
        parts.sort(Comparator.comparing(CratePart::getId));

        List<PlacedComponent> components = new ArrayList<>();
        BoundingBox included = BoundingBox.EMPTY;
        // Placement labels number the sorted parts, skipped ones included
        for (int i = 0; i < parts.size(); i++) {
            CratePart part = parts.get(i);
            if (isDegenerate(part.getBounds())) {
                log.warn("Skipping degenerate part {} with bounds {}", part.getId(), part.getBounds());
                continue;
            }
            components.add(emitPart(part, i + 1, ctx));
            included = included.union(part.getBounds());
        }

        List<String> placements = components.stream().map(PlacedComponent::globalPlacement).toList();
        String rootShape = out.add("SHAPE_REPRESENTATION('" + escape(options.getProductName()) + "',"
                + list(placements) + "," + ctx.geometricContext() + ")");
        out.add("SHAPE_DEFINITION_REPRESENTATION(" + ctx.assemblyDefinitionShape() + "," + rootShape + ")");

        for (int i = 0; i < components.size(); i++) {
            linkIntoAssembly(components.get(i), i + 1, rootShape, ctx);
        }

        if (options.isIncludePmi() && !included.isEmpty()) {
            addBoundingBoxPmi(included, ctx);
        }

        log.debug("Exported {} of {} parts as {} STEP entities", components.size(), parts.size(),
                out.getEntityCount());

        StringBuilder sb = new StringBuilder();
        for (String line : headerLines()) {
            sb.append(line).append('\n');
        }
        sb.append("DATA;\n");
        for (String line : out.getLines()) {
            sb.append(line).append('\n');
        }
        sb.append("ENDSEC;\n");
        sb.append("END-ISO-10303-21;\n");
        return sb.toString();
    }

    static List<String> headerLines() {
        return List.of(
                "ISO-10303-21;",
                "HEADER;",
                "FILE_DESCRIPTION(('AutoCrate crate model'),'2;1');",
                "FILE_NAME('crate_model.step','" + FIXED_TIMESTAMP
                        + "',('AutoCrate'),('Antimony Labs'),'S3M2P STEP Writer','S3M2P','');",
                "FILE_SCHEMA(('" + SCHEMA + "'));",
                "ENDSEC;");
    }

    // Shared application context, inch units and the root assembly product.
    private Contexts createContexts(String productName) {
        String name = escape(productName);
        String app = out.add("APPLICATION_CONTEXT('mechanical design')");
        out.add("APPLICATION_PROTOCOL_DEFINITION('international standard',"
                + "'ap242_managed_model_based_3d_engineering_mim_latest',2020," + app + ")");
        String mechanical = out.add("MECHANICAL_CONTEXT(''," + app + ",'mechanical')");
        out.add("PRODUCT_CONTEXT('" + name + "'," + app + ",'design')");
        String designContext = out.add("DESIGN_CONTEXT('" + name + "'," + app + ",'design')");

        String planeAngle = out.add("(NAMED_UNIT(*)PLANE_ANGLE_UNIT()SI_UNIT($,.RADIAN.))");
        String solidAngle = out.add("(NAMED_UNIT(*)SI_UNIT($,.STERADIAN.)SOLID_ANGLE_UNIT())");
        String millimetre = out.add("(LENGTH_UNIT()NAMED_UNIT(*)SI_UNIT(.MILLI.,.METRE.))");
        String inchMeasure = out.add("LENGTH_MEASURE_WITH_UNIT(LENGTH_MEASURE(" + MILLIMETRES_PER_INCH + "),"
                + millimetre + ")");
        String inch = out.add("(NAMED_UNIT(*)LENGTH_UNIT()CONVERSION_BASED_UNIT('INCH'," + inchMeasure + "))");
        String uncertainty = out.add("UNCERTAINTY_MEASURE_WITH_UNIT(LENGTH_MEASURE(0.01)," + inch
                + ",'distance accuracy','')");
        String geometric = out.add("(GEOMETRIC_REPRESENTATION_CONTEXT(3)"
                + "GLOBAL_UNIT_ASSIGNED_CONTEXT((" + inch + "," + planeAngle + "," + solidAngle + "))"
                + "GLOBAL_UNCERTAINTY_ASSIGNED_CONTEXT((" + uncertainty + "))"
                + "REPRESENTATION_CONTEXT('','3D'))");

        String product = out.add("PRODUCT('" + name + "','" + name + "','',(" + mechanical + "))");
        String formation = out.add("PRODUCT_DEFINITION_FORMATION('',''," + product + ")");
        String definition = out.add("PRODUCT_DEFINITION('crate definition',''," + formation + ","
                + designContext + ")");
        String definitionShape = out.add("PRODUCT_DEFINITION_SHAPE('',''," + definition + ")");

        return new Contexts(mechanical, designContext, inch, geometric, definition, definitionShape);
    }

    private PlacedComponent emitPart(CratePart part, int index, Contexts ctx) {
        String solid = boxSolid(part.getId(), part.getBounds().size());
        Product product = componentProduct(part, ctx);

        String shape = out.add("ADVANCED_BREP_SHAPE_REPRESENTATION('" + escape(part.getId()) + "',("
                + solid + ")," + ctx.geometricContext() + ")");
        out.add("SHAPE_DEFINITION_REPRESENTATION(" + product.definitionShape() + "," + shape + ")");

        String local = axis2Placement(part.getId() + "_LOCAL", Point3.ORIGIN);
        String global = axis2Placement(part.getId() + "_ASM_" + index, part.getBounds().getMin());
        return new PlacedComponent(part, product, shape, local, global);
    }

    private Product componentProduct(CratePart part, Contexts ctx) {
        String id = escape(part.getId());
        String product = out.add("PRODUCT('" + id + "','" + escape(part.getName()) + "','',("
                + ctx.mechanicalContext() + "))");
        String formation = out.add("PRODUCT_DEFINITION_FORMATION('',''," + product + ")");
        String definition = out.add("PRODUCT_DEFINITION('" + id + " definition',''," + formation + ","
                + ctx.designContext() + ")");
        String definitionShape = out.add("PRODUCT_DEFINITION_SHAPE('',''," + definition + ")");
        return new Product(definition, definitionShape);
    }

    private void linkIntoAssembly(PlacedComponent component, int index, String rootShape, Contexts ctx) {
        String id = escape(component.part().getId());
        String transform = out.add("ITEM_DEFINED_TRANSFORMATION('" + id + "_TRANSFORM_" + index + "',''," +
                component.localPlacement() + "," + component.globalPlacement() + ")");
        String relationship = out.add("(REPRESENTATION_RELATIONSHIP('" + id + "',''," + rootShape + ","
                + component.shapeRepresentation() + ")"
                + "REPRESENTATION_RELATIONSHIP_WITH_TRANSFORMATION(" + transform + ")"
                + "SHAPE_REPRESENTATION_RELATIONSHIP())");
        String usage = out.add("NEXT_ASSEMBLY_USAGE_OCCURRENCE('NAUO_" + index + "','" + id + "',''," +
                ctx.assemblyDefinition() + "," + component.product().definition() + ",$)");
        String usageShape = out.add("PRODUCT_DEFINITION_SHAPE('',''," + usage + ")");
        out.add("CONTEXT_DEPENDENT_SHAPE_REPRESENTATION(" + relationship + "," + usageShape + ")");
    }

    private String axis2Placement(String label, Point3 origin) {
        String p = out.add("CARTESIAN_POINT(''," + point(origin.x(), origin.y(), origin.z()) + ")");
        String z = out.add("DIRECTION(''," + DIR_Z_POS + ")");
        String x = out.add("DIRECTION(''," + DIR_X_POS + ")");
        return out.add("AXIS2_PLACEMENT_3D('" + escape(label) + "'," + p + "," + z + "," + x + ")");
    }

    /**
     * Emits a box from (0,0,0) to {@code size} in the part's local frame.
     * <pre>
     *   v0 (0,0,0)  v1 (w,0,0)  v2 (w,l,0)  v3 (0,l,0)   bottom
     *   v4 (0,0,h)  v5 (w,0,h)  v6 (w,l,h)  v7 (0,l,h)   top
     * </pre>
     * Every face loop runs counter-clockwise seen from outside, so each edge is used
     * once forward and once reversed across the shell.
     */
    private String boxSolid(String name, Vector3 size) {
        double w = size.x();
        double l = size.y();
        double h = size.z();

        Point3[] corners = {
                new Point3(0, 0, 0), new Point3(w, 0, 0), new Point3(w, l, 0), new Point3(0, l, 0),
                new Point3(0, 0, h), new Point3(w, 0, h), new Point3(w, l, h), new Point3(0, l, h)
        };
        String[] points = new String[8];
        String[] vertices = new String[8];
        for (int i = 0; i < corners.length; i++) {
            Point3 c = corners[i];
            points[i] = out.add("CARTESIAN_POINT(''," + point(c.x(), c.y(), c.z()) + ")");
            vertices[i] = out.add("VERTEX_POINT(''," + points[i] + ")");
        }

        String xPos = out.add("DIRECTION(''," + DIR_X_POS + ")");
        String yPos = out.add("DIRECTION(''," + DIR_Y_POS + ")");
        String zPos = out.add("DIRECTION(''," + DIR_Z_POS + ")");
        String xNeg = out.add("DIRECTION(''," + DIR_X_NEG + ")");
        String yNeg = out.add("DIRECTION(''," + DIR_Y_NEG + ")");
        String zNeg = out.add("DIRECTION(''," + DIR_Z_NEG + ")");

        String e0 = edgeCurve(points, vertices, 0, 1, xPos, w);
        String e1 = edgeCurve(points, vertices, 1, 2, yPos, l);
        String e2 = edgeCurve(points, vertices, 3, 2, xPos, w);
        String e3 = edgeCurve(points, vertices, 0, 3, yPos, l);
        String e4 = edgeCurve(points, vertices, 4, 5, xPos, w);
        String e5 = edgeCurve(points, vertices, 5, 6, yPos, l);
        String e6 = edgeCurve(points, vertices, 7, 6, xPos, w);
        String e7 = edgeCurve(points, vertices, 4, 7, yPos, l);
        String e8 = edgeCurve(points, vertices, 0, 4, zPos, h);
        String e9 = edgeCurve(points, vertices, 1, 5, zPos, h);
        String e10 = edgeCurve(points, vertices, 2, 6, zPos, h);
        String e11 = edgeCurve(points, vertices, 3, 7, zPos, h);

        List<String> faces = new ArrayList<>(6);
        faces.add(face(new String[]{e3, e2, e1, e0}, new boolean[]{true, true, false, false},
                new Point3(w / 2, l / 2, 0), zNeg, xPos));
        faces.add(face(new String[]{e4, e5, e6, e7}, new boolean[]{true, true, false, false},
                new Point3(w / 2, l / 2, h), zPos, xPos));
        faces.add(face(new String[]{e0, e9, e4, e8}, new boolean[]{true, true, false, false},
                new Point3(w / 2, 0, h / 2), yNeg, xPos));
        faces.add(face(new String[]{e2, e11, e6, e10}, new boolean[]{false, true, true, false},
                new Point3(w / 2, l, h / 2), yPos, xPos));
        faces.add(face(new String[]{e8, e7, e11, e3}, new boolean[]{true, true, false, false},
                new Point3(0, l / 2, h / 2), xNeg, yPos));
        faces.add(face(new String[]{e1, e10, e5, e9}, new boolean[]{true, true, false, false},
                new Point3(w, l / 2, h / 2), xPos, yPos));

        String shell = out.add("CLOSED_SHELL(''," + list(faces) + ")");
        return out.add("MANIFOLD_SOLID_BREP('" + escape(name) + "'," + shell + ")");
    }

    private String edgeCurve(String[] points, String[] vertices, int from, int to, String direction, double length) {
        String vector = out.add("VECTOR(''," + direction + "," + real(length) + ")");
        String line = out.add("LINE(''," + points[from] + "," + vector + ")");
        return out.add("EDGE_CURVE(''," + vertices[from] + "," + vertices[to] + "," + line + ",.T.)");
    }

    private String face(String[] edges, boolean[] forward, Point3 center, String normal, String refDirection) {
        List<String> oriented = new ArrayList<>(edges.length);
        for (int i = 0; i < edges.length; i++) {
            oriented.add(out.add("ORIENTED_EDGE('',*,*," + edges[i] + "," + bool(forward[i]) + ")"));
        }
        String origin = out.add("CARTESIAN_POINT(''," + point(center.x(), center.y(), center.z()) + ")");
        String axis = out.add("AXIS2_PLACEMENT_3D(''," + origin + "," + normal + "," + refDirection + ")");
        String plane = out.add("PLANE(''," + axis + ")");
        String loop = out.add("EDGE_LOOP(''," + list(oriented) + ")");
        String bound = out.add("FACE_OUTER_BOUND(''," + loop + ",.T.)");
        return out.add("ADVANCED_FACE('',(" + bound + ")," + plane + ",.T.)");
    }

    private void addBoundingBoxPmi(BoundingBox bounds, Contexts ctx) {
        Vector3 size = bounds.size();
        addLengthProperty("overall_width_in", size.x(), ctx);
        addLengthProperty("overall_length_in", size.y(), ctx);
        addLengthProperty("overall_height_in", size.z(), ctx);
    }

    private void addLengthProperty(String label, double value, Contexts ctx) {
        String measure = out.add("LENGTH_MEASURE_WITH_UNIT(LENGTH_MEASURE(" + real3(value) + "),"
                + ctx.lengthUnit() + ")");
        String item = out.add("MEASURE_REPRESENTATION_ITEM('" + label + "'," + measure + ")");
        String rep = out.add("REPRESENTATION('" + label + "',(" + item + ")," + ctx.geometricContext() + ")");
        String property = out.add("PROPERTY_DEFINITION('" + label + "','product characteristic',"
                + ctx.assemblyDefinition() + ")");
        out.add("PROPERTY_DEFINITION_REPRESENTATION(" + property + "," + rep + ")");
    }

    private record Contexts(String mechanicalContext, String designContext, String lengthUnit,
                            String geometricContext, String assemblyDefinition, String assemblyDefinitionShape) {
    }

    private record Product(String definition, String definitionShape) {
    }

    private record PlacedComponent(CratePart part, Product product, String shapeRepresentation,
                                   String localPlacement, String globalPlacement) {
    }
}
