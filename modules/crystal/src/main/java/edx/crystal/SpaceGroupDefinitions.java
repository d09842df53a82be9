// ******************************************************************************
//
// Title:       Electron Diffraction X.
// Description: Electron Diffraction X - Software for Serial Electron Crystallography.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of Electron Diffraction X.
//
// Electron Diffraction X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Electron Diffraction X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Electron Diffraction X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package edx.crystal;

import static edx.crystal.CrystalSystem.CUBIC;
import static edx.crystal.CrystalSystem.HEXAGONAL;
import static edx.crystal.CrystalSystem.MONOCLINIC;
import static edx.crystal.CrystalSystem.ORTHORHOMBIC;
import static edx.crystal.CrystalSystem.TETRAGONAL;
import static edx.crystal.CrystalSystem.TRICLINIC;
import static edx.crystal.CrystalSystem.TRIGONAL;
import static edx.crystal.LaueSystem.L_1;
import static edx.crystal.LaueSystem.L_2M;
import static edx.crystal.LaueSystem.L_31M;
import static edx.crystal.LaueSystem.L_3;
import static edx.crystal.LaueSystem.L_3M1;
import static edx.crystal.LaueSystem.L_4M;
import static edx.crystal.LaueSystem.L_4MMM;
import static edx.crystal.LaueSystem.L_6M;
import static edx.crystal.LaueSystem.L_6MMM;
import static edx.crystal.LaueSystem.L_M3;
import static edx.crystal.LaueSystem.L_M3M;
import static edx.crystal.LaueSystem.L_MMM;
import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Definitions of the supported space groups.
 * <p>
 * Each space group is defined by a small set of generators in coordinate triplet notation plus its
 * lattice centering. The full operator list is obtained by closing the generators under composition,
 * with translations reduced modulo 1. Settings follow International Tables Volume A (unique axis b,
 * origin choice 2, hexagonal axes for rhombohedral groups).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SpaceGroupDefinitions {

  private static final Logger logger = Logger.getLogger(SpaceGroupDefinitions.class.getName());

  /**
   * The closure of any space group has at most 192 operators.
   */
  private static final int MAX_OPERATORS = 192;

  private static final Map<String, Definition> definitions = new LinkedHashMap<>();
  private static final Map<Integer, Definition> numbers = new LinkedHashMap<>();
  private static final Map<String, SpaceGroup> cache = new ConcurrentHashMap<>();

  static {
    // Triclinic.
    define(1, "P1", "1", TRICLINIC, L_1, 'P');
    define(2, "P-1", "-1", TRICLINIC, L_1, 'P', "-x,-y,-z");

    // Monoclinic.
    define(3, "P2", "2", MONOCLINIC, L_2M, 'P', "-x,y,-z");
    define(4, "P21", "2", MONOCLINIC, L_2M, 'P', "-x,y+1/2,-z");
    define(5, "C2", "2", MONOCLINIC, L_2M, 'C', "-x,y,-z");
    define(6, "Pm", "m", MONOCLINIC, L_2M, 'P', "x,-y,z");
    define(7, "Pc", "m", MONOCLINIC, L_2M, 'P', "x,-y,z+1/2");
    define(9, "Cc", "m", MONOCLINIC, L_2M, 'C', "x,-y,z+1/2");
    define(10, "P2/m", "2/m", MONOCLINIC, L_2M, 'P', "-x,y,-z", "-x,-y,-z");
    define(11, "P21/m", "2/m", MONOCLINIC, L_2M, 'P', "-x,y+1/2,-z", "-x,-y,-z");
    define(12, "C2/m", "2/m", MONOCLINIC, L_2M, 'C', "-x,y,-z", "-x,-y,-z");
    define(13, "P2/c", "2/m", MONOCLINIC, L_2M, 'P', "-x,y,-z+1/2", "-x,-y,-z");
    define(14, "P21/c", "2/m", MONOCLINIC, L_2M, 'P', "-x,y+1/2,-z+1/2", "-x,-y,-z");
    define(15, "C2/c", "2/m", MONOCLINIC, L_2M, 'C', "-x,y,-z+1/2", "-x,-y,-z");

    // Orthorhombic.
    define(16, "P222", "222", ORTHORHOMBIC, L_MMM, 'P', "-x,-y,z", "x,-y,-z");
    define(18, "P21212", "222", ORTHORHOMBIC, L_MMM, 'P', "-x,-y,z", "x+1/2,-y+1/2,-z");
    define(19, "P212121", "222", ORTHORHOMBIC, L_MMM, 'P', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z");
    define(20, "C2221", "222", ORTHORHOMBIC, L_MMM, 'C', "-x,-y,z+1/2", "x,-y,-z");
    define(21, "C222", "222", ORTHORHOMBIC, L_MMM, 'C', "-x,-y,z", "x,-y,-z");
    define(22, "F222", "222", ORTHORHOMBIC, L_MMM, 'F', "-x,-y,z", "x,-y,-z");
    define(23, "I222", "222", ORTHORHOMBIC, L_MMM, 'I', "-x,-y,z", "x,-y,-z");
    define(24, "I212121", "222", ORTHORHOMBIC, L_MMM, 'I', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z");
    define(29, "Pca21", "mm2", ORTHORHOMBIC, L_MMM, 'P', "-x,-y,z+1/2", "x+1/2,-y,z");
    define(33, "Pna21", "mm2", ORTHORHOMBIC, L_MMM, 'P', "-x,-y,z+1/2", "x+1/2,-y+1/2,z");
    define(47, "Pmmm", "mmm", ORTHORHOMBIC, L_MMM, 'P', "-x,-y,z", "x,-y,-z", "-x,-y,-z");
    define(61, "Pbca", "mmm", ORTHORHOMBIC, L_MMM, 'P', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z", "-x,-y,-z");
    define(62, "Pnma", "mmm", ORTHORHOMBIC, L_MMM, 'P', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z+1/2", "-x,-y,-z");
    define(69, "Fmmm", "mmm", ORTHORHOMBIC, L_MMM, 'F', "-x,-y,z", "x,-y,-z", "-x,-y,-z");
    define(71, "Immm", "mmm", ORTHORHOMBIC, L_MMM, 'I', "-x,-y,z", "x,-y,-z", "-x,-y,-z");

    // Tetragonal.
    define(75, "P4", "4", TETRAGONAL, L_4M, 'P', "-y,x,z");
    define(76, "P41", "4", TETRAGONAL, L_4M, 'P', "-y,x,z+1/4");
    define(78, "P43", "4", TETRAGONAL, L_4M, 'P', "-y,x,z+3/4");
    define(79, "I4", "4", TETRAGONAL, L_4M, 'I', "-y,x,z");
    define(80, "I41", "4", TETRAGONAL, L_4M, 'I', "-y,x+1/2,z+1/4");
    define(81, "P-4", "-4", TETRAGONAL, L_4M, 'P', "y,-x,-z");
    define(83, "P4/m", "4/m", TETRAGONAL, L_4M, 'P', "-y,x,z", "-x,-y,-z");
    define(88, "I41/a", "4/m", TETRAGONAL, L_4M, 'I', "-y+3/4,x+1/4,z+1/4", "-x,-y,-z");
    define(89, "P422", "422", TETRAGONAL, L_4MMM, 'P', "-y,x,z", "x,-y,-z");
    define(92, "P41212", "422", TETRAGONAL, L_4MMM, 'P', "-y+1/2,x+1/2,z+1/4", "x+1/2,-y+1/2,-z+3/4");
    define(96, "P43212", "422", TETRAGONAL, L_4MMM, 'P', "-y+1/2,x+1/2,z+3/4", "x+1/2,-y+1/2,-z+1/4");
    define(97, "I422", "422", TETRAGONAL, L_4MMM, 'I', "-y,x,z", "x,-y,-z");
    define(99, "P4mm", "4mm", TETRAGONAL, L_4MMM, 'P', "-y,x,z", "x,-y,z");
    define(123, "P4/mmm", "4/mmm", TETRAGONAL, L_4MMM, 'P', "-y,x,z", "x,-y,-z", "-x,-y,-z");
    define(139, "I4/mmm", "4/mmm", TETRAGONAL, L_4MMM, 'I', "-y,x,z", "x,-y,-z", "-x,-y,-z");

    // Trigonal.
    define(143, "P3", "3", TRIGONAL, L_3, 'P', "-y,x-y,z");
    define(144, "P31", "3", TRIGONAL, L_3, 'P', "-y,x-y,z+1/3");
    define(145, "P32", "3", TRIGONAL, L_3, 'P', "-y,x-y,z+2/3");
    define(146, "R3", "3", TRIGONAL, L_3, 'R', "-y,x-y,z");
    define(147, "P-3", "-3", TRIGONAL, L_3, 'P', "-y,x-y,z", "-x,-y,-z");
    define(148, "R-3", "-3", TRIGONAL, L_3, 'R', "-y,x-y,z", "-x,-y,-z");
    define(149, "P312", "32", TRIGONAL, L_31M, 'P', "-y,x-y,z", "-y,-x,-z");
    define(150, "P321", "32", TRIGONAL, L_3M1, 'P', "-y,x-y,z", "y,x,-z");
    define(152, "P3121", "32", TRIGONAL, L_3M1, 'P', "-y,x-y,z+1/3", "y,x,-z");
    define(154, "P3221", "32", TRIGONAL, L_3M1, 'P', "-y,x-y,z+2/3", "y,x,-z");
    define(155, "R32", "32", TRIGONAL, L_3M1, 'R', "-y,x-y,z", "y,x,-z");
    define(160, "R3m", "3m", TRIGONAL, L_3M1, 'R', "-y,x-y,z", "-y,-x,z");
    define(162, "P-31m", "-3m", TRIGONAL, L_31M, 'P', "-y,x-y,z", "-y,-x,-z", "-x,-y,-z");
    define(164, "P-3m1", "-3m", TRIGONAL, L_3M1, 'P', "-y,x-y,z", "y,x,-z", "-x,-y,-z");
    define(166, "R-3m", "-3m", TRIGONAL, L_3M1, 'R', "-y,x-y,z", "y,x,-z", "-x,-y,-z");
    define(167, "R-3c", "-3m", TRIGONAL, L_3M1, 'R', "-y,x-y,z", "y,x,-z+1/2", "-x,-y,-z");

    // Hexagonal.
    define(168, "P6", "6", HEXAGONAL, L_6M, 'P', "x-y,x,z");
    define(169, "P61", "6", HEXAGONAL, L_6M, 'P', "x-y,x,z+1/6");
    define(173, "P63", "6", HEXAGONAL, L_6M, 'P', "x-y,x,z+1/2");
    define(175, "P6/m", "6/m", HEXAGONAL, L_6M, 'P', "x-y,x,z", "-x,-y,-z");
    define(176, "P63/m", "6/m", HEXAGONAL, L_6M, 'P', "x-y,x,z+1/2", "-x,-y,-z");
    define(177, "P622", "622", HEXAGONAL, L_6MMM, 'P', "x-y,x,z", "y,x,-z");
    define(178, "P6122", "622", HEXAGONAL, L_6MMM, 'P', "x-y,x,z+1/6", "y,x,-z+1/3");
    define(182, "P6322", "622", HEXAGONAL, L_6MMM, 'P', "x-y,x,z+1/2", "y,x,-z");
    define(191, "P6/mmm", "6/mmm", HEXAGONAL, L_6MMM, 'P', "x-y,x,z", "y,x,-z", "-x,-y,-z");
    define(194, "P63/mmc", "6/mmm", HEXAGONAL, L_6MMM, 'P', "x-y,x,z+1/2", "y,x,-z", "-x,-y,-z");

    // Cubic.
    define(195, "P23", "23", CUBIC, L_M3, 'P', "-x,-y,z", "x,-y,-z", "z,x,y");
    define(196, "F23", "23", CUBIC, L_M3, 'F', "-x,-y,z", "x,-y,-z", "z,x,y");
    define(197, "I23", "23", CUBIC, L_M3, 'I', "-x,-y,z", "x,-y,-z", "z,x,y");
    define(198, "P213", "23", CUBIC, L_M3, 'P', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z", "z,x,y");
    define(199, "I213", "23", CUBIC, L_M3, 'I', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z", "z,x,y");
    define(200, "Pm-3", "m-3", CUBIC, L_M3, 'P', "-x,-y,z", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(202, "Fm-3", "m-3", CUBIC, L_M3, 'F', "-x,-y,z", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(204, "Im-3", "m-3", CUBIC, L_M3, 'I', "-x,-y,z", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(205, "Pa-3", "m-3", CUBIC, L_M3, 'P', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z", "z,x,y", "-x,-y,-z");
    define(206, "Ia-3", "m-3", CUBIC, L_M3, 'I', "-x+1/2,-y,z+1/2", "x+1/2,-y+1/2,-z", "z,x,y", "-x,-y,-z");
    define(207, "P432", "432", CUBIC, L_M3M, 'P', "-y,x,z", "x,-y,-z", "z,x,y");
    define(209, "F432", "432", CUBIC, L_M3M, 'F', "-y,x,z", "x,-y,-z", "z,x,y");
    define(211, "I432", "432", CUBIC, L_M3M, 'I', "-y,x,z", "x,-y,-z", "z,x,y");
    define(215, "P-43m", "-43m", CUBIC, L_M3M, 'P', "y,-x,-z", "x,-y,-z", "z,x,y");
    define(216, "F-43m", "-43m", CUBIC, L_M3M, 'F', "y,-x,-z", "x,-y,-z", "z,x,y");
    define(217, "I-43m", "-43m", CUBIC, L_M3M, 'I', "y,-x,-z", "x,-y,-z", "z,x,y");
    define(218, "P-43n", "-43m", CUBIC, L_M3M, 'P', "y+1/2,-x+1/2,-z+1/2", "x,-y,-z", "z,x,y");
    define(221, "Pm-3m", "m-3m", CUBIC, L_M3M, 'P', "-y,x,z", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(223, "Pm-3n", "m-3m", CUBIC, L_M3M, 'P', "-y+1/2,x+1/2,z+1/2", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(225, "Fm-3m", "m-3m", CUBIC, L_M3M, 'F', "-y,x,z", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(226, "Fm-3c", "m-3m", CUBIC, L_M3M, 'F', "-y,x,z+1/2", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(227, "Fd-3m", "m-3m", CUBIC, L_M3M, 'F', "-y+1/4,x+1/4,z+1/4", "x,-y,-z", "z,x,y", "-x+1/4,-y+1/4,-z+1/4");
    define(229, "Im-3m", "m-3m", CUBIC, L_M3M, 'I', "-y,x,z", "x,-y,-z", "z,x,y", "-x,-y,-z");
    define(230, "Ia-3d", "m-3m", CUBIC, L_M3M, 'I', "-y+1/4,x+3/4,z+1/4", "x,-y,-z+1/2", "z,x,y", "-x,-y,-z");
  }

  private SpaceGroupDefinitions() {
  }

  private static void define(int number, String name, String pointGroup, CrystalSystem crystalSystem,
      LaueSystem laueSystem, char centering, String... generators) {
    Definition definition = new Definition(number, name, pointGroup, crystalSystem, laueSystem, centering, generators);
    definitions.put(name, definition);
    numbers.putIfAbsent(number, definition);
  }

  /**
   * Return the SpaceGroup for a Hermann-Mauguin symbol. Spaces are ignored, so "P 21 21 21" and
   * "P212121" are equivalent.
   *
   * @param name the space group symbol.
   * @return the SpaceGroup, or null if the symbol is not supported.
   */
  public static SpaceGroup spaceGroupFactory(String name) {
    if (name == null) {
      return null;
    }
    String key = name.replace(" ", "").replace("_", "");
    Definition definition = definitions.get(key);
    if (definition == null) {
      return null;
    }
    return cache.computeIfAbsent(definition.name, k -> build(definition));
  }

  /**
   * Return the SpaceGroup for a space group number.
   *
   * @param number the space group number.
   * @return the SpaceGroup, or null if the number is not supported.
   */
  public static SpaceGroup spaceGroupFactory(int number) {
    Definition definition = numbers.get(number);
    if (definition == null) {
      return null;
    }
    return spaceGroupFactory(definition.name);
  }

  /**
   * The names of all supported space groups, in order of space group number.
   *
   * @return an unmodifiable list of names.
   */
  public static List<String> getSupportedNames() {
    return Collections.unmodifiableList(new ArrayList<>(definitions.keySet()));
  }

  /**
   * Lattice centering translations.
   *
   * @param centering the centering symbol.
   * @return the non-zero centering vectors.
   */
  static double[][] centeringVectors(char centering) {
    return switch (centering) {
      case 'P' -> new double[0][];
      case 'A' -> new double[][]{{0.0, 0.5, 0.5}};
      case 'B' -> new double[][]{{0.5, 0.0, 0.5}};
      case 'C' -> new double[][]{{0.5, 0.5, 0.0}};
      case 'I' -> new double[][]{{0.5, 0.5, 0.5}};
      case 'F' -> new double[][]{{0.0, 0.5, 0.5}, {0.5, 0.0, 0.5}, {0.5, 0.5, 0.0}};
      case 'R' -> new double[][]{{2.0 / 3.0, 1.0 / 3.0, 1.0 / 3.0}, {1.0 / 3.0, 2.0 / 3.0, 2.0 / 3.0}};
      default -> throw new IllegalArgumentException(format(" Unknown lattice centering %s.", centering));
    };
  }

  /**
   * Close the generators and centering translations under composition.
   *
   * @param definition the space group definition.
   * @return the SpaceGroup.
   */
  private static SpaceGroup build(Definition definition) {
    List<SymOp> symOps = new ArrayList<>();
    symOps.add(SymOp.identity());
    List<SymOp> seeds = new ArrayList<>();
    for (String generator : definition.generators) {
      seeds.add(SymOp.parse(generator));
    }
    for (double[] t : centeringVectors(definition.centering)) {
      seeds.add(SymOp.translation(t));
    }
    for (SymOp seed : seeds) {
      if (!symOps.contains(seed)) {
        symOps.add(seed);
      }
    }

    boolean changed = true;
    while (changed) {
      changed = false;
      int n = symOps.size();
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < n; j++) {
          SymOp product = SymOp.combineSymOps(symOps.get(j), symOps.get(i));
          if (!symOps.contains(product)) {
            symOps.add(product);
            changed = true;
          }
        }
      }
      if (symOps.size() > MAX_OPERATORS) {
        throw new IllegalStateException(format(" Generators of %s do not close.", definition.name));
      }
    }

    SpaceGroup spaceGroup = new SpaceGroup(definition.number, definition.name, definition.pointGroup,
        definition.crystalSystem, definition.laueSystem, definition.centering, symOps);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(spaceGroup.toString());
    }
    return spaceGroup;
  }

  private static final class Definition {
    private final int number;
    private final String name;
    private final String pointGroup;
    private final CrystalSystem crystalSystem;
    private final LaueSystem laueSystem;
    private final char centering;
    private final String[] generators;

    private Definition(int number, String name, String pointGroup, CrystalSystem crystalSystem,
        LaueSystem laueSystem, char centering, String[] generators) {
      this.number = number;
      this.name = name;
      this.pointGroup = pointGroup;
      this.crystalSystem = crystalSystem;
      this.laueSystem = laueSystem;
      this.centering = centering;
      this.generators = generators;
    }
  }
}
