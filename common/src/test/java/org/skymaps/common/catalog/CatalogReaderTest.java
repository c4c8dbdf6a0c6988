package org.skymaps.common.catalog;

import org.skymaps.common.render.Colormaps;
import org.skymaps.common.source.FitsSourceDataProvider;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.Test;

import static org.junit.Assert.*;

public class CatalogReaderTest {

  private static LayerRegistry read(String resource) throws IOException {
    try (InputStream in = CatalogReaderTest.class.getResourceAsStream(resource)) {
      return CatalogReader.read(in, Path.of("/catalogs"));
    }
  }

  @Test
  public void testRead() throws IOException {
    LayerRegistry registry = read("/catalog/catalog.json");
    assertEquals(2, registry.size());

    Layer intensity = registry.get("coadd-f090-i");
    assertEquals("I", intensity.getName());
    assertEquals("ACT DR6", intensity.getGroup());
    assertEquals("Coadd", intensity.getMap());
    assertEquals("f090", intensity.getBand());
    assertEquals("uK", intensity.getUnits());
    assertEquals("T (I)", intensity.getQuantity());
    assertEquals("act", intensity.getGrant()); // inherited from the group

    RenderDefaults defaults = intensity.getDefaults();
    assertEquals("RdBu_r", defaults.getColormap());
    assertEquals(-500, defaults.getVmin(), 0);
    assertEquals(500, defaults.getVmax(), 0);
    assertFalse(defaults.isLogNorm());
    assertTrue(defaults.isClip());
    assertTrue(defaults.hasBounds());

    // relative to the catalog directory
    FitsSourceDataProvider source = (FitsSourceDataProvider) intensity.getSource();
    assertEquals(new File("/catalogs/coadd.fits"), source.getFile());
  }

  @Test
  public void testDefaults() throws IOException {
    Layer ivar = read("/catalog/catalog.json").get("coadd-f090-ivar");
    assertEquals("act-internal", ivar.getGrant());
    assertEquals(Colormaps.DEFAULT, ivar.getDefaults().getColormap());
    assertNull(ivar.getDefaults().getVmin());
    assertFalse(ivar.getDefaults().hasBounds());
    assertTrue(ivar.getDefaults().isLogNorm());
    assertFalse(ivar.getDefaults().isClip());
    assertEquals(new File("/data/maps/ivar.fits"), ((FitsSourceDataProvider) ivar.getSource()).getFile());
  }

  @Test
  public void testLayerOrder() throws IOException {
    LayerRegistry registry = read("/catalog/catalog.json");
    assertEquals("coadd-f090-i", registry.layers().iterator().next().getLayerId());
  }

  @Test(expected = LayerNotFoundException.class)
  public void testUnknownLayer() throws IOException {
    read("/catalog/catalog.json").get("nope");
  }

  @Test
  public void testFind() throws IOException {
    LayerRegistry registry = read("/catalog/catalog.json");
    assertTrue(registry.find("coadd-f090-i").isPresent());
    assertFalse(registry.find("nope").isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateIdentifiers() throws IOException {
    parse(layers(layer("dup", "a.fits"), layer("dup", "b.fits")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingIdentifier() throws IOException {
    parse(layers("{\"name\": \"x\", \"provider\": {\"provider_type\": \"fits\", \"filename\": \"a.fits\"}}"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownColormap() throws IOException {
    parse(layers("{\"layer_id\": \"x\", \"cmap\": \"jet\", "
                 + "\"provider\": {\"provider_type\": \"fits\", \"filename\": \"a.fits\"}}"));
  }

  @Test(expected = IOException.class)
  public void testUnknownProviderType() throws IOException {
    parse(layers("{\"layer_id\": \"x\", \"provider\": {\"provider_type\": \"hips\", \"filename\": \"a\"}}"));
  }

  private static String layer(String id, String filename) {
    return "{\"layer_id\": \"" + id + "\", \"provider\": {\"provider_type\": \"fits\", \"filename\": \"" + filename
           + "\"}}";
  }

  private static String layers(String... layers) {
    return "{\"map_groups\": [{\"name\": \"g\", \"maps\": [{\"name\": \"m\", \"bands\": [{\"name\": \"b\", "
           + "\"layers\": [" + String.join(",", layers) + "]}]}]}]}";
  }

  private static LayerRegistry parse(String json) throws IOException {
    return CatalogReader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), Path.of("/catalogs"));
  }
}
